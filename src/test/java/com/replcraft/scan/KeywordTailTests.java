package com.replcraft.scan;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Unit tests for {@link KeywordTail}.
 */
class KeywordTailTests {

	private final KeywordTail tail = new KeywordTail(new GoKeywords());

	private static byte[] b(String s) {
		return s.getBytes(StandardCharsets.UTF_8);
	}

	@Test
	void testTrailingWord() {
		Assertions.assertEquals("if", KeywordTail.trailingWord(b("if\n"), 1));
		Assertions.assertEquals("else", KeywordTail.trailingWord(b("} else\n"), 5));
		Assertions.assertNull(KeywordTail.trailingWord(b("f()\n"), 2));
	}

	@Test
	void testClauseKeywordsForceContinuation() {
		Assertions.assertTrue(tail.forcesContinuation(b("if\n"), 1));
		Assertions.assertTrue(tail.forcesContinuation(b("} else\n"), 5));
		Assertions.assertTrue(tail.forcesContinuation(b("x := func\n"), 8));
	}

	@Test
	void testTerminalKeywordsDoNotForceContinuation() {
		Assertions.assertFalse(tail.forcesContinuation(b("return\n"), 5));
		Assertions.assertFalse(tail.forcesContinuation(b("break\n"), 4));
		Assertions.assertFalse(tail.forcesContinuation(b("continue\n"), 7));
		Assertions.assertFalse(tail.forcesContinuation(b("fallthrough\n"), 10));
	}

	@Test
	void testIdentifiersDoNotForceContinuation() {
		Assertions.assertFalse(tail.forcesContinuation(b("x := y\n"), 5));
	}

	@Test
	void testKeywordSuffixOfLongerIdentifier() {
		Assertions.assertFalse(tail.forcesContinuation(b("xif\n"), 2));
		Assertions.assertFalse(tail.forcesContinuation(b("Xif\n"), 2));
		Assertions.assertFalse(tail.forcesContinuation(b("a_if\n"), 3));
		Assertions.assertFalse(tail.forcesContinuation(b("v2if\n"), 3));
	}

	@Test
	void testNoTokenOnLine() {
		Assertions.assertFalse(tail.forcesContinuation(b("\n"), -1));
		Assertions.assertFalse(tail.forcesContinuation(b("if\n"), 7));
	}

	@Test
	void testExtraKeywords() {
		KeywordTail macro = new KeywordTail(new GoKeywords(Arrays.asList("macro")));
		Assertions.assertTrue(macro.forcesContinuation(b("macro\n"), 4));
		Assertions.assertFalse(tail.forcesContinuation(b("macro\n"), 4));
	}
}
