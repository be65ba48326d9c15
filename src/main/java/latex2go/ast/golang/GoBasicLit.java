package latex2go.ast.golang;

/**
 * A numeric literal, already in Go spelling.
 */
public record GoBasicLit(String value) implements GoExpr {
}
