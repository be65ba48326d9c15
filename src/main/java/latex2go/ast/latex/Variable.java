package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

public record Variable(String name, SourceSpan span) implements Expr {
	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitVariable(this);
	}
}
