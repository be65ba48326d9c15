package latex2go.ast.golang;

import java.util.List;

public record GoBlock(List<GoStmt> stmts) implements GoNode {
	public GoBlock {
		stmts = List.copyOf(stmts);
	}

	public static GoBlock of(GoStmt... stmts) {
		return new GoBlock(List.of(stmts));
	}
}
