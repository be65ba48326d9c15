package latex2go;

import java.io.PrintStream;

public final class CodeWriters {
	private CodeWriters() {
	}

	/**
	 * Blank or null path -> standard output, anything else -> that file.
	 */
	public static CodeWriter forOutputPath(String outputPath, PrintStream stdout) {
		if (outputPath == null || outputPath.isBlank()) {
			return new StdoutCodeWriter(stdout);
		}
		return new FileCodeWriter(outputPath);
	}

	public static CodeWriter forOutputPath(String outputPath) {
		return forOutputPath(outputPath, System.out);
	}
}
