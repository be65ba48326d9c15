package latex2go.ast.golang;

/**
 * {@code var name type = value}, with an optional trailing line comment.
 */
public record GoVarStmt(String name, String type, GoExpr value, String comment) implements GoStmt {
}
