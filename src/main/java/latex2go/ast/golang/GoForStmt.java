package latex2go.ast.golang;

/**
 * Three-clause loop. Only define/assign statements are valid as {@code init} and {@code post}.
 */
public record GoForStmt(GoStmt init, GoExpr cond, GoStmt post, GoBlock body) implements GoStmt {
}
