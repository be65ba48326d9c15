package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

import java.util.List;

/**
 * A command applied to braced arguments, e.g. {@code \sqrt{x}} or {@code \frac{a}{b}}.
 * The name is the command without its backslash.
 */
public record FuncCall(String name, List<Expr> args, SourceSpan span) implements Expr {
	public FuncCall {
		args = List.copyOf(args);
	}

	@Override
	public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
		return visitor.visitCall(this);
	}
}
