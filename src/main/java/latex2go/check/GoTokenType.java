package latex2go.check;

public enum GoTokenType {
	IDENT,
	NUMBER,
	STRING,
	SYMBOL,
	ILLEGAL,
	EOF
}
