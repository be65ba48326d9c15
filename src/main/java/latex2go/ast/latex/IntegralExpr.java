package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

/**
 * {@code \int_{lower}^{upper} body dvar}. Bounds are null for indefinite integrals.
 */
public record IntegralExpr(boolean definite, String var, Expr lower, Expr upper, Expr body, SourceSpan span)
		implements Expr {
	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitIntegral(this);
	}
}
