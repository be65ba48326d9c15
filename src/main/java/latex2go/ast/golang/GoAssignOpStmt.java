package latex2go.ast.golang;

/**
 * Compound assignment such as {@code _sum += x}; {@code op} is the operator without '='.
 */
public record GoAssignOpStmt(String name, String op, GoExpr value) implements GoStmt {
}
