package latex2go;

import java.io.IOException;

/**
 * Destination for generated Go source.
 */
public interface CodeWriter {
	void write(String code) throws IOException;
}
