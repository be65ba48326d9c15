package latex2go.ast.golang;

public record GoIdent(String name) implements GoExpr {
}
