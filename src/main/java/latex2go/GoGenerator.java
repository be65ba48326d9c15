package latex2go;

import latex2go.ast.latex.Expr;
import latex2go.check.GoSyntaxChecker;
import latex2go.print.GoPrinter;
import latex2go.transform.GenerateException;
import latex2go.transform.GoTranslation;
import latex2go.transform.LatexToGoTransformer;
import latex2go.transform.Limitation;
import latex2go.transform.Lowered;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Expr -> formatted, syntax-checked Go source.
 */
public final class GoGenerator {
	private static final Logger logger = LoggerFactory.getLogger(GoGenerator.class);

	private final LatexToGoTransformer transformer = new LatexToGoTransformer();
	private final GoPrinter printer = new GoPrinter();
	private final GoSyntaxChecker checker = new GoSyntaxChecker();

	public GeneratedCode generate(Expr root, String packageName, String functionName) throws GenerateException {
		GoTranslation translation = transformer.transform(root, packageName, functionName);
		String source = printer.print(translation.file());

		List<String> problems = checker.check(source);
		if (!problems.isEmpty()) {
			throw new GenerateException(GenerateException.Kind.FORMAT_FAILURE,
					"generated code is not valid Go: " + String.join("; ", problems), source);
		}

		for (Limitation limitation : translation.limitations()) {
			logger.warn("generated code has a limitation ({}): {}", limitation.kind(), limitation.message());
		}
		return new GeneratedCode(source, translation.importsMath(), translation.parameters(),
				translation.limitations());
	}

	/**
	 * The lowered form of one sub-expression: Go code plus its math-import flag.
	 */
	public Lowered generateExpr(Expr expr) throws GenerateException {
		return transformer.lower(expr);
	}
}
