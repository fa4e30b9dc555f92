package org.metricshub.timewarp.frontend.pascal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.metricshub.timewarp.frontend.ParserException;

public class PascalParserTest {

	private static PascalProgram parse(String source) {
		return new PascalParser("test.twp").parse(source);
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
	public void testDeclarations() {
		PascalProgram program = parse(
				"program Demo(output);\n"
						+ "var a: integer; s: string; arr: array[0..4] of real;\n"
						+ "function sq(x: integer): integer;\n"
						+ "begin sq := x * x end;\n"
						+ "procedure swap(var p, q: integer);\n"
						+ "var t: integer;\n"
						+ "begin t := p; p := q; q := t end;\n"
						+ "begin a := sq(3) end.\n");
		assertEquals("Demo", program.getName());
		assertEquals(3, program.getGlobalTypes().size());
		assertEquals(PascalType.INTEGER, program.getGlobalTypes().get(0));
		assertEquals(PascalType.STRING, program.getGlobalTypes().get(1));
		assertEquals("array[0..4] of real", program.getGlobalTypes().get(2).toString());
		assertEquals(5, program.getGlobalTypes().get(2).getLength());
		assertEquals("arr", program.getGlobalName(2));

		assertEquals(2, program.getRoutines().size());
		Routine sq = program.getRoutines().get(0);
		assertTrue(sq.isFunction());
		assertEquals(PascalType.INTEGER, sq.getResultType());
		assertFalse(sq.getParameters().get(0).isByReference());
		Routine swap = program.getRoutines().get(1);
		assertFalse(swap.isFunction());
		assertEquals(2, swap.getParameters().size());
		assertTrue(swap.getParameters().get(1).isByReference());
	}

	@Test
	public void testHeaderIsOptional() {
		assertNull(parse("begin end.").getName());
	}

	@Test
	public void testUnknownIdentifier() {
		ParserException e = parseError("begin\n  x := 1\nend.");
		assertEquals("Unknown identifier x", e.getReason());
		assertEquals(2, e.getLine());
		assertEquals(3, e.getColumn());
	}

	@Test
	public void testMissingSemicolon() {
		ParserException e = parseError("begin writeln(1) writeln(2) end.");
		assertEquals("Expected END but found 'writeln'", e.getReason());
		assertEquals(18, e.getColumn());
	}

	@Test
	public void testDeclarationErrors() {
		assertEquals("Duplicate identifier a", parseError("var a: integer; a: real;\nbegin end.").getReason());
		assertEquals("Array lower bound must be 0", parseError("var a: array[1..3] of integer;\nbegin end.").getReason());
		assertEquals("Unknown type text", parseError("var f: text;\nbegin end.").getReason());
		assertEquals("Type declarations are not supported", parseError("type t = integer;\nbegin end.").getReason());
	}

	@Test
	public void testConstantsAreReadOnly() {
		assertEquals("Cannot assign to constant n", parseError("const n = 3;\nbegin n := 4 end.").getReason());
	}

	@Test
	public void testTextAfterTheEnd() {
		assertEquals("Unexpected 'x' after the end of the program", parseError("begin end. x").getReason());
	}
}
