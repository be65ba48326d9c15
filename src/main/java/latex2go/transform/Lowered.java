package latex2go.transform;

import latex2go.ast.golang.GoBlock;
import latex2go.ast.golang.GoCallExpr;
import latex2go.ast.golang.GoExpr;
import latex2go.ast.golang.GoFuncLit;
import latex2go.ast.golang.GoReturnStmt;
import latex2go.ast.golang.GoStmt;

import java.util.List;

/**
 * Result of lowering one LaTeX sub-expression: either a single Go expression
 * or a statement block ending in {@code return}, plus whether it uses {@code math}.
 */
public record Lowered(GoExpr expr, List<GoStmt> block, boolean needsMath) {
	public Lowered {
		if ((expr == null) == (block == null)) {
			throw new IllegalArgumentException("exactly one of expr and block must be set");
		}
		block = block == null ? null : List.copyOf(block);
	}

	public static Lowered expr(GoExpr expr, boolean needsMath) {
		return new Lowered(expr, null, needsMath);
	}

	public static Lowered block(List<GoStmt> block, boolean needsMath) {
		return new Lowered(null, block, needsMath);
	}

	public boolean isBlock() {
		return block != null;
	}

	/**
	 * Usable anywhere an expression is: blocks become {@code func() float64 { ... }()}.
	 */
	public GoExpr asExpr() {
		if (expr != null) {
			return expr;
		}
		GoFuncLit literal = new GoFuncLit(List.of(), LatexToGoTransformer.FLOAT, new GoBlock(block));
		return new GoCallExpr(literal, List.of());
	}

	public GoBlock asBody() {
		if (block != null) {
			return new GoBlock(block);
		}
		return GoBlock.of(new GoReturnStmt(expr));
	}
}
