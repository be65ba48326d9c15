package latex2go.ast.golang;

/**
 * {@code name := value}, with an optional trailing line comment (null for none).
 */
public record GoDefineStmt(String name, GoExpr value, String comment) implements GoStmt {
	public GoDefineStmt(String name, GoExpr value) {
		this(name, value, null);
	}
}
