package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

public record DerivativeExpr(boolean partial, String var, int order, Expr body, SourceSpan span) implements Expr {
	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitDerivative(this);
	}
}
