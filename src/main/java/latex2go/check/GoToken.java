package latex2go.check;

import latex2go.ast.SourceSpan;

public record GoToken(GoTokenType type, String lexeme, SourceSpan span) {
	public boolean is(GoTokenType type, String lexeme) {
		return this.type == type && this.lexeme.equals(lexeme);
	}
}
