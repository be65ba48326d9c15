package latex2go.ast.golang;

import java.util.List;

/**
 * Anonymous function, used for sampled closures and immediately invoked blocks.
 */
public record GoFuncLit(List<GoParam> params, String resultType, GoBlock body) implements GoExpr {
	public GoFuncLit {
		params = List.copyOf(params);
	}
}
