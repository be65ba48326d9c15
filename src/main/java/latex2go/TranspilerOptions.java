package latex2go;

/**
 * Names used for the generated file and where it goes.
 *
 * @param moduleName   Go package clause
 * @param functionName name of the generated function
 * @param outputPath   target file; null or blank means standard output
 */
public record TranspilerOptions(String moduleName, String functionName, String outputPath) {
	public static final String DEFAULT_MODULE_NAME = "main";
	public static final String DEFAULT_FUNCTION_NAME = "calculate";

	public TranspilerOptions() {
		this(DEFAULT_MODULE_NAME, DEFAULT_FUNCTION_NAME, null);
	}

	public TranspilerOptions withDefaults() {
		return new TranspilerOptions(
				isBlank(moduleName) ? DEFAULT_MODULE_NAME : moduleName.trim(),
				isBlank(functionName) ? DEFAULT_FUNCTION_NAME : functionName.trim(),
				isBlank(outputPath) ? null : outputPath);
	}

	public boolean writesToStdout() {
		return isBlank(outputPath);
	}

	private static boolean isBlank(String s) {
		return s == null || s.isBlank();
	}
}
