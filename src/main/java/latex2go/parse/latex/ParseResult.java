package latex2go.parse.latex;

import latex2go.ast.latex.Expr;

import java.util.List;

/**
 * A successful parse together with the warnings it produced.
 */
public record ParseResult(Expr expr, List<Diagnostic> warnings) {
	public ParseResult {
		warnings = List.copyOf(warnings);
	}
}
