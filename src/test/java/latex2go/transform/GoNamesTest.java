package latex2go.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GoNamesTest {
	@Test
	void keywordsGetSuffix() {
		assertEquals("func_", GoNames.sanitize("func"));
		assertEquals("range_", GoNames.sanitize("range"));
		assertEquals("math_", GoNames.sanitize("math"));
		assertEquals("x", GoNames.sanitize("x"));
	}

	@Test
	void identifierValidity() {
		assertTrue(GoNames.isIdentifier("calculate"));
		assertTrue(GoNames.isIdentifier("_f2"));
		assertTrue(GoNames.isIdentifier("math"));
		assertFalse(GoNames.isIdentifier("func"));
		assertFalse(GoNames.isIdentifier("2x"));
		assertFalse(GoNames.isIdentifier("my-func"));
		assertFalse(GoNames.isIdentifier(""));
	}
}
