package latex2go.ast.golang;

public record GoIncStmt(String name) implements GoStmt {
}
