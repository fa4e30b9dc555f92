package org.metricshub.timewarp.frontend.basic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.metricshub.timewarp.frontend.ParserException;

public class BasicParserTest {

	private static BasicProgram parse(String source) {
		return new BasicParser("test.twb").parse(source);
	}

	private static ParserException parseError(String source) {
		try {
			parse(source);
		} catch (ParserException e) {
			return e;
		}
		fail("Accepted: " + source);
		return null;
	}

	@Test
	public void testLinesLabelsAndVariables() {
		BasicProgram program = parse("20 print b\n10 LET a = 1\n*Start\nT: hi\n");
		assertEquals(Integer.valueOf(0), program.getLineAddress(10));
		assertTrue(program.getLineAddress(20) > 0);
		assertNull(program.getLineAddress(30));
		assertTrue(program.getLabels().contains("START"));
		assertTrue(program.getVariableNames().contains("A"));
		assertTrue(program.getVariableNames().contains("B"));
		assertEquals("test.twb", program.getSourceDescription());
	}

	@Test
	public void testRepeatedLineNumberKeepsFreeFormLines() {
		BasicProgram program = parse("10 A = 1\nB = 2\n20 C = 4\n10 D = 3\n");
		assertFalse(program.getVariableNames().contains("A"));
		assertTrue(program.getVariableNames().contains("B"));
		assertTrue(program.getVariableNames().contains("D"));
		assertEquals(Integer.valueOf(0), program.getLineAddress(10));
	}

	@Test
	public void testTextVariables() {
		assertTrue(BasicProgram.isTextVariable("N$"));
		assertTrue(parse("10 N$ = \"x\"\n").getVariableNames().contains("N$"));
	}

	@Test
	public void testForWithoutNext() {
		ParserException e = parseError("10 FOR I = 1 TO 3\n20 PRINT I\n");
		assertEquals("FOR without NEXT", e.getReason());
		assertEquals(1, e.getLine());
		assertEquals(4, e.getColumn());
		assertEquals("FOR without NEXT (test.twb, line 1, column 4)", e.getMessage());
	}

	@Test
	public void testWendWithoutWhile() {
		ParserException e = parseError("10 PRINT 1\n20 WEND\n");
		assertEquals("WEND without WHILE", e.getReason());
		assertEquals(2, e.getLine());
	}

	@Test
	public void testUnclosedRepeat() {
		ParserException e = parseError("REPEAT 4 [FD 10\n");
		assertEquals("Missing ']'", e.getReason());
		assertEquals(10, e.getColumn());
	}

	@Test
	public void testUnknownStatement() {
		ParserException e = parseError("10 PRINT 1\n20 FOO 3\n");
		assertEquals("Unknown statement FOO", e.getReason());
		assertEquals(2, e.getLine());
		assertEquals(4, e.getColumn());
	}

	@Test
	public void testKeywordIsNotAVariable() {
		assertEquals("PRINT cannot be used as a variable name", parseError("10 LET PRINT = 1\n").getReason());
	}

	@Test
	public void testMissingExpression() {
		assertEquals("Expected an expression but found end of input", parseError("10 X =\n").getReason());
	}

	@Test
	public void testDuplicateLabel() {
		ParserException e = parseError("*A\nT: one\n*a\n");
		assertEquals("Duplicate label *A", e.getReason());
		assertEquals(3, e.getLine());
	}
}
