package latex2go.ast.golang;

public record GoBinaryExpr(GoExpr left, String op, GoExpr right) implements GoExpr {
}
