package latex2go.print;

import latex2go.ast.golang.GoAssignOpStmt;
import latex2go.ast.golang.GoBasicLit;
import latex2go.ast.golang.GoBinaryExpr;
import latex2go.ast.golang.GoBlock;
import latex2go.ast.golang.GoCallExpr;
import latex2go.ast.golang.GoCommentStmt;
import latex2go.ast.golang.GoDefineStmt;
import latex2go.ast.golang.GoExpr;
import latex2go.ast.golang.GoFile;
import latex2go.ast.golang.GoForStmt;
import latex2go.ast.golang.GoFuncDecl;
import latex2go.ast.golang.GoFuncLit;
import latex2go.ast.golang.GoIdent;
import latex2go.ast.golang.GoIfStmt;
import latex2go.ast.golang.GoImportDecl;
import latex2go.ast.golang.GoIncStmt;
import latex2go.ast.golang.GoParam;
import latex2go.ast.golang.GoParenExpr;
import latex2go.ast.golang.GoReturnStmt;
import latex2go.ast.golang.GoSelectorExpr;
import latex2go.ast.golang.GoStmt;
import latex2go.ast.golang.GoVarStmt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the Go AST with gofmt-style layout: tab indentation, one blank line
 * between the package clause, imports and declarations, and a trailing newline.
 *
 * Output always uses '\n', independent of the platform.
 */
public final class GoPrinter {
	private static final String NL = "\n";

	public String print(GoFile file) {
		StringBuilder out = new StringBuilder();
		out.append("package ").append(file.packageName()).append(NL);

		List<GoImportDecl> imports = file.imports();
		if (imports.size() == 1) {
			out.append(NL).append("import \"").append(imports.get(0).path()).append('"').append(NL);
		} else if (!imports.isEmpty()) {
			out.append(NL).append("import (").append(NL);
			for (GoImportDecl imp : imports) {
				out.append('\t').append('"').append(imp.path()).append('"').append(NL);
			}
			out.append(")").append(NL);
		}

		for (GoFuncDecl func : file.funcs()) {
			out.append(NL);
			printFunc(func, out);
		}
		return out.toString();
	}

	public String printExpr(GoExpr expr) {
		StringBuilder out = new StringBuilder();
		printExpr(expr, 0, out);
		return out.toString();
	}

	/**
	 * Statements of a block, one per line at the given indent, without braces.
	 */
	public String printBlock(GoBlock block, int indent) {
		StringBuilder out = new StringBuilder();
		printStmts(block, indent, out);
		return out.toString();
	}

	private void printFunc(GoFuncDecl func, StringBuilder out) {
		out.append("func ").append(func.name());
		printSignature(func.params(), func.resultType(), out);
		out.append(" {").append(NL);
		printStmts(func.body(), 1, out);
		out.append("}").append(NL);
	}

	private static void printSignature(List<GoParam> params, String resultType, StringBuilder out) {
		out.append('(')
				.append(params.stream().map(p -> p.name() + " " + p.type()).collect(Collectors.joining(", ")))
				.append(") ")
				.append(resultType);
	}

	private void printStmts(GoBlock block, int indent, StringBuilder out) {
		for (GoStmt stmt : block.stmts()) {
			indent(indent, out);
			printStmt(stmt, indent, out);
			out.append(NL);
		}
	}

	private void printStmt(GoStmt stmt, int indent, StringBuilder out) {
		if (stmt instanceof GoReturnStmt ret) {
			out.append("return ");
			printExpr(ret.value(), indent, out);
			return;
		}
		if (stmt instanceof GoDefineStmt define) {
			out.append(define.name()).append(" := ");
			printExpr(define.value(), indent, out);
			trailingComment(define.comment(), out);
			return;
		}
		if (stmt instanceof GoVarStmt var) {
			out.append("var ").append(var.name()).append(' ').append(var.type()).append(" = ");
			printExpr(var.value(), indent, out);
			trailingComment(var.comment(), out);
			return;
		}
		if (stmt instanceof GoAssignOpStmt assign) {
			out.append(assign.name()).append(' ').append(assign.op()).append("= ");
			printExpr(assign.value(), indent, out);
			return;
		}
		if (stmt instanceof GoIncStmt inc) {
			out.append(inc.name()).append("++");
			return;
		}
		if (stmt instanceof GoForStmt loop) {
			out.append("for ");
			printStmt(loop.init(), indent, out);
			out.append("; ");
			printExpr(loop.cond(), indent, out);
			out.append("; ");
			printStmt(loop.post(), indent, out);
			out.append(" {").append(NL);
			printStmts(loop.body(), indent + 1, out);
			indent(indent, out);
			out.append('}');
			return;
		}
		if (stmt instanceof GoIfStmt branch) {
			out.append("if ");
			printExpr(branch.cond(), indent, out);
			out.append(" {").append(NL);
			printStmts(branch.then(), indent + 1, out);
			indent(indent, out);
			out.append('}');
			return;
		}
		if (stmt instanceof GoCommentStmt comment) {
			out.append("// ").append(comment.text());
			return;
		}
		throw new IllegalArgumentException("unsupported Go statement: " + stmt.getClass().getSimpleName());
	}

	private void printExpr(GoExpr expr, int indent, StringBuilder out) {
		if (expr instanceof GoIdent ident) {
			out.append(ident.name());
			return;
		}
		if (expr instanceof GoBasicLit literal) {
			out.append(literal.value());
			return;
		}
		if (expr instanceof GoBinaryExpr binary) {
			printExpr(binary.left(), indent, out);
			out.append(' ').append(binary.op()).append(' ');
			printExpr(binary.right(), indent, out);
			return;
		}
		if (expr instanceof GoParenExpr paren) {
			out.append('(');
			printExpr(paren.inner(), indent, out);
			out.append(')');
			return;
		}
		if (expr instanceof GoCallExpr call) {
			printExpr(call.fun(), indent, out);
			out.append('(');
			for (int i = 0; i < call.args().size(); i++) {
				if (i > 0) {
					out.append(", ");
				}
				printExpr(call.args().get(i), indent, out);
			}
			out.append(')');
			return;
		}
		if (expr instanceof GoSelectorExpr selector) {
			out.append(selector.pkg()).append('.').append(selector.name());
			return;
		}
		if (expr instanceof GoFuncLit fn) {
			out.append("func");
			printSignature(fn.params(), fn.resultType(), out);
			out.append(" {").append(NL);
			printStmts(fn.body(), indent + 1, out);
			indent(indent, out);
			out.append('}');
			return;
		}
		throw new IllegalArgumentException("unsupported Go expression: " + expr.getClass().getSimpleName());
	}

	private static void trailingComment(String comment, StringBuilder out) {
		if (comment != null && !comment.isEmpty()) {
			out.append(" // ").append(comment);
		}
	}

	private static void indent(int depth, StringBuilder out) {
		for (int i = 0; i < depth; i++) {
			out.append('\t');
		}
	}
}
