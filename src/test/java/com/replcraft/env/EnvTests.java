package com.replcraft.env;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

class EnvTests {

	private static Env env(String... kv) {
		Map<String, String> m = new HashMap<String, String>();
		for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
		return new Env(m);
	}

	@Test
	void testDefaults() {
		Env e = env();
		Assertions.assertEquals("> ", e.prompt());
		Assertions.assertFalse(e.trace());
		Assertions.assertFalse(e.collectAllComments());
		Assertions.assertEquals(Collections.emptyList(), e.extraKeywords());
	}

	@Test
	void testPromptOverride() {
		Assertions.assertEquals("go> ", env(Env.ENV_PROMPT, "go> ").prompt());
		Assertions.assertEquals("> ", env(Env.ENV_PROMPT, "").prompt());
	}

	@Test
	void testFlags() {
		Assertions.assertTrue(env(Env.ENV_TRACE, "1").trace());
		Assertions.assertTrue(env(Env.ENV_TRACE, " TRUE ").trace());
		Assertions.assertFalse(env(Env.ENV_TRACE, "no").trace());
		Assertions.assertTrue(env(Env.ENV_ALL_COMMENTS, "yes").collectAllComments());
	}

	@Test
	void testExtraKeywords() {
		String v = "macro, lambda" + File.pathSeparator + "quote,,";
		Assertions.assertEquals(Arrays.asList("macro", "lambda", "quote"), env(Env.ENV_KEYWORDS, v).extraKeywords());
	}
}
