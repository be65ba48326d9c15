package latex2go.ast.golang;

import java.util.List;

public record GoFile(String packageName, List<GoImportDecl> imports, List<GoFuncDecl> funcs) implements GoNode {
	public GoFile {
		imports = List.copyOf(imports);
		funcs = List.copyOf(funcs);
	}
}
