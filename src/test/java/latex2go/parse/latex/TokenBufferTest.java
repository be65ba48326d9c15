package latex2go.parse.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TokenBufferTest {
	@Test
	void peeksAheadAndAdvances() {
		TokenBuffer buffer = new TokenBuffer(new LatexLexer("a + b"));

		assertEquals("a", buffer.peek(0).literal());
		assertEquals("+", buffer.peek(1).literal());
		assertEquals("b", buffer.peek(2).literal());

		buffer.advance();
		assertEquals("+", buffer.peek(0).literal());
		assertEquals(LatexTokenType.EOF, buffer.peek(2).type());
	}

	@Test
	void eofRepeatsPastEndOfInput() {
		TokenBuffer buffer = new TokenBuffer(new LatexLexer("a"));
		for (int i = 0; i < 20; i++) {
			buffer.advance();
		}

		assertEquals(LatexTokenType.EOF, buffer.peek(0).type());
		assertEquals(LatexTokenType.EOF, buffer.peek(TokenBuffer.CAPACITY - 1).type());
	}

	@Test
	void lookaheadIsBounded() {
		TokenBuffer buffer = new TokenBuffer(new LatexLexer("a"));

		assertThrows(IllegalArgumentException.class, () -> buffer.peek(TokenBuffer.CAPACITY));
		assertThrows(IllegalArgumentException.class, () -> buffer.peek(-1));
	}
}
