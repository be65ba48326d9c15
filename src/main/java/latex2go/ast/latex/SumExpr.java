package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

/**
 * {@code \sum_{var=lower}^{upper} body}, or {@code \prod} when {@code product} is set.
 */
public record SumExpr(boolean product, String var, Expr lower, Expr upper, Expr body, SourceSpan span)
		implements Expr {
	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitSum(this);
	}
}
