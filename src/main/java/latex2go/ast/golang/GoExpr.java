package latex2go.ast.golang;

public sealed interface GoExpr extends GoNode permits GoIdent, GoBasicLit, GoBinaryExpr, GoParenExpr, GoCallExpr,
		GoSelectorExpr, GoFuncLit {
}
