package latex2go.ast.golang;

public record GoImportDecl(String path) implements GoNode {
}
