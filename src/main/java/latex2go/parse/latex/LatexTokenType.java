package latex2go.parse.latex;

public enum LatexTokenType {
	EOF(Kind.END_OF_INPUT),
	ILLEGAL(Kind.ILLEGAL),

	IDENT(Kind.IDENTIFIER),
	NUMBER(Kind.NUMBER),

	PLUS(Kind.OPERATOR),
	MINUS(Kind.OPERATOR),
	ASTERISK(Kind.OPERATOR),
	SLASH(Kind.OPERATOR),
	CARET(Kind.OPERATOR),
	EQUALS(Kind.OPERATOR),
	EXCLAMATION(Kind.OPERATOR),
	LESS(Kind.OPERATOR),
	GREATER(Kind.OPERATOR),

	UNDERSCORE(Kind.DELIMITER),
	LPAREN(Kind.DELIMITER),
	RPAREN(Kind.DELIMITER),
	LBRACE(Kind.DELIMITER),
	RBRACE(Kind.DELIMITER),
	// column separator and row break inside \begin{cases}
	AMPERSAND(Kind.DELIMITER),
	ROW_BREAK(Kind.DELIMITER),

	COMMAND(Kind.COMMAND),
	BEGIN(Kind.ENVIRONMENT_BEGIN),
	END(Kind.ENVIRONMENT_END);

	/**
	 * Coarse classification shared by all token types.
	 */
	public enum Kind {
		END_OF_INPUT, ILLEGAL, IDENTIFIER, NUMBER, OPERATOR, DELIMITER, COMMAND, ENVIRONMENT_BEGIN, ENVIRONMENT_END
	}

	private final Kind kind;

	LatexTokenType(Kind kind) {
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}
}
