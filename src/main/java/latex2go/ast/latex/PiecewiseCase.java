package latex2go.ast.latex;

/**
 * One row of a {@code cases} environment. A null condition marks the default row.
 */
public record PiecewiseCase(Expr value, Expr condition) {
	public boolean isDefault() {
		return condition == null;
	}
}
