package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

import java.util.List;

public record PiecewiseExpr(List<PiecewiseCase> cases, SourceSpan span) implements Expr {
	public PiecewiseExpr {
		cases = List.copyOf(cases);
	}

	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitPiecewise(this);
	}
}
