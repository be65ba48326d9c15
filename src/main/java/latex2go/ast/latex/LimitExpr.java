package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

public record LimitExpr(String var, Expr approaches, Expr body, SourceSpan span) implements Expr {
	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitLimit(this);
	}
}
