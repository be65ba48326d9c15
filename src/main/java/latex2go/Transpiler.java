package latex2go;

import latex2go.parse.latex.LatexParser;
import latex2go.parse.latex.ParseException;
import latex2go.transform.GenerateException;

/**
 * Public entrypoint for LaTeX -> Go transpilation of a single string.
 */
public final class Transpiler {
	private final LatexParser parser = new LatexParser();
	private final GoGenerator generator = new GoGenerator();

	public String transpile(String latex) throws ParseException, GenerateException {
		return transpile(latex, null, null);
	}

	/**
	 * Blank module or function names fall back to {@code main} and {@code calculate}.
	 */
	public String transpile(String latex, String moduleName, String functionName)
			throws ParseException, GenerateException {
		if (latex == null || latex.isBlank()) {
			throw new IllegalArgumentException("input LaTeX string cannot be empty");
		}
		TranspilerOptions options = new TranspilerOptions(moduleName, functionName, null).withDefaults();
		return generator.generate(parser.parse(latex), options.moduleName(), options.functionName()).source();
	}
}
