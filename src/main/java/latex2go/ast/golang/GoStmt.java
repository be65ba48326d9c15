package latex2go.ast.golang;

public sealed interface GoStmt extends GoNode permits GoReturnStmt, GoDefineStmt, GoVarStmt, GoAssignOpStmt, GoIncStmt,
		GoForStmt, GoIfStmt, GoCommentStmt {
}
