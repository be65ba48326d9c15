package latex2go.parse.latex;

import java.util.Iterator;

/**
 * Fixed-size ring buffer of upcoming tokens.
 *
 * {@code peek(0)} is the current token; lookahead is bounded by the capacity.
 * Once the source reports EOF, that token is repeated for every later slot.
 */
final class TokenBuffer {
	static final int CAPACITY = 8;

	private final Iterator<LatexToken> source;
	private final LatexToken[] ring = new LatexToken[CAPACITY];
	private int head;
	private LatexToken eof;

	TokenBuffer(Iterator<LatexToken> source) {
		this.source = source;
		for (int i = 0; i < CAPACITY; i++) {
			ring[i] = pull();
		}
	}

	LatexToken peek(int distance) {
		if (distance < 0 || distance >= CAPACITY) {
			throw new IllegalArgumentException("lookahead " + distance + " outside 0.." + (CAPACITY - 1));
		}
		return ring[(head + distance) % CAPACITY];
	}

	void advance() {
		ring[head] = pull();
		head = (head + 1) % CAPACITY;
	}

	private LatexToken pull() {
		if (eof != null) {
			return eof;
		}
		LatexToken t = source.next();
		if (t.type() == LatexTokenType.EOF) {
			eof = t;
		}
		return t;
	}
}
