package latex2go.ast.golang;

public record GoIfStmt(GoExpr cond, GoBlock then) implements GoStmt {
}
