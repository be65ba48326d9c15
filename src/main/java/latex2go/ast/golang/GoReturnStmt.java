package latex2go.ast.golang;

public record GoReturnStmt(GoExpr value) implements GoStmt {
}
