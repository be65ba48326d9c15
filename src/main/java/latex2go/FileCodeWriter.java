package latex2go;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated code to a file, replacing any existing content.
 */
public final class FileCodeWriter implements CodeWriter {
	private static final Logger logger = LoggerFactory.getLogger(FileCodeWriter.class);

	private final Path path;

	public FileCodeWriter(String path) {
		if (path == null || path.isBlank()) {
			throw new IllegalArgumentException("FileCodeWriter requires a non-empty file path");
		}
		this.path = Path.of(path);
	}

	public Path path() {
		return path;
	}

	@Override
	public void write(String code) throws IOException {
		try {
			Files.writeString(path, code, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new IOException("failed to write code to file '" + path + "'", ex);
		}
		logger.info("Wrote generated Go code to {}", path.toAbsolutePath());
	}
}
