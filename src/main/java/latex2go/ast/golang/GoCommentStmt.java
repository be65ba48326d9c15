package latex2go.ast.golang;

/**
 * A whole-line comment; {@code text} excludes the leading {@code //}.
 */
public record GoCommentStmt(String text) implements GoStmt {
}
