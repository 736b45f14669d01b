package com.replcraft.scan;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;

class GoKeywordsTests {

	@Test
	void testClassify() {
		GoKeywords k = new GoKeywords();
		Assertions.assertEquals(KeywordClass.KEYWORD, k.classify("if"));
		Assertions.assertEquals(KeywordClass.KEYWORD, k.classify("interface"));
		Assertions.assertEquals(KeywordClass.TERMINAL, k.classify("return"));
		Assertions.assertEquals(KeywordClass.TERMINAL, k.classify("fallthrough"));
		Assertions.assertEquals(KeywordClass.IDENTIFIER, k.classify("fmt"));
		Assertions.assertEquals(KeywordClass.IDENTIFIER, k.classify("If"));
	}

	@Test
	void testExtraWordsAreNeverTerminal() {
		GoKeywords k = new GoKeywords(Collections.singletonList("return"));
		Assertions.assertEquals(KeywordClass.TERMINAL, k.classify("return"));
		Assertions.assertEquals(KeywordClass.KEYWORD, new GoKeywords(Collections.singletonList("lambda")).classify("lambda"));
	}
}
