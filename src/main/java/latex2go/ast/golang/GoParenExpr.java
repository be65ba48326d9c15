package latex2go.ast.golang;

public record GoParenExpr(GoExpr inner) implements GoExpr {
}
