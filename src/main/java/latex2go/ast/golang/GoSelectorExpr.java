package latex2go.ast.golang;

/**
 * Package-qualified name, e.g. {@code math.Pow}.
 */
public record GoSelectorExpr(String pkg, String name) implements GoExpr {
}
