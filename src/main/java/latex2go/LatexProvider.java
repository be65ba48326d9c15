package latex2go;

import java.io.IOException;

/**
 * Source of the LaTeX text to translate and the options to translate it with.
 */
public interface LatexProvider {
	LatexInput getLatexInput() throws IOException;
}
