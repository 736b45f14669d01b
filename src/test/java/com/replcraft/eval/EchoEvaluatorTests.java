package com.replcraft.eval;

import com.replcraft.input.ReadResult;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

class EchoEvaluatorTests {

	private static String echo(String text, OptionalInt first) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		new EchoEvaluator(new PrintStream(buf, true)).evaluate(
				new ReadResult(text.getBytes(StandardCharsets.UTF_8), first, false));
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	void testPrintsCodeWithoutLeadingComments() {
		Assertions.assertEquals("x\n", echo("// c\nx\n", OptionalInt.of(5)));
	}

	@Test
	void testAddsMissingNewline() {
		Assertions.assertEquals("x\n", echo("x", OptionalInt.of(0)));
	}

	@Test
	void testCommentOnlyPrintsNothing() {
		Assertions.assertEquals("", echo("// c\n", OptionalInt.empty()));
	}
}
