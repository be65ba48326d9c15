package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

/**
 * A number together with its source text, which is emitted unchanged so that
 * digits beyond double precision are not lost.
 */
public record NumberLiteral(double value, String text, SourceSpan span) implements Expr {
	public NumberLiteral(double value, SourceSpan span) {
		this(value, format(value), span);
	}

	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitNumber(this);
	}

	private static String format(double value) {
		if (value == Math.rint(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		return Double.toString(value);
	}
}
