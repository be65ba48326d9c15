package latex2go.ast.golang;

import java.util.List;

public record GoFuncDecl(String name, List<GoParam> params, String resultType, GoBlock body) implements GoNode {
	public GoFuncDecl {
		params = List.copyOf(params);
	}
}
