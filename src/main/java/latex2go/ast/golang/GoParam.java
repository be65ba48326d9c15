package latex2go.ast.golang;

public record GoParam(String name, String type) implements GoNode {
}
