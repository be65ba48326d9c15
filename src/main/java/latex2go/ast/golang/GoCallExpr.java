package latex2go.ast.golang;

import java.util.List;

public record GoCallExpr(GoExpr fun, List<GoExpr> args) implements GoExpr {
	public GoCallExpr {
		args = List.copyOf(args);
	}
}
