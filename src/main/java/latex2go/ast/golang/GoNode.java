package latex2go.ast.golang;

/**
 * Target-side syntax tree for the generated Go file. Nodes carry no source
 * spans: they are synthesized, never parsed.
 */
public sealed interface GoNode permits GoFile, GoImportDecl, GoFuncDecl, GoParam, GoBlock, GoStmt, GoExpr {
}
