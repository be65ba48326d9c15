package latex2go.parse.latex;

import latex2go.ast.SourceSpan;

public record LatexToken(LatexTokenType type, String literal, SourceSpan span) {
	public int offset() {
		return span.startOffset();
	}

	public boolean is(LatexTokenType type, String literal) {
		return this.type == type && this.literal.equals(literal);
	}

	@Override
	public String toString() {
		return type + "('" + literal + "')";
	}
}
