package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

import java.util.Set;

/**
 * Two-operand operation. Arithmetic ops are {@code + - * / ^}; piecewise
 * conditions additionally use the comparisons {@code < > <= >= == !=}.
 */
public record BinaryExpr(String op, Expr left, Expr right, SourceSpan span) implements Expr {
	public static final Set<String> COMPARISONS = Set.of("<", ">", "<=", ">=", "==", "!=");

	public boolean isComparison() {
		return COMPARISONS.contains(op);
	}

	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitBinary(this);
	}
}
