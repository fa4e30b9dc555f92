package org.metricshub.timewarp.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import org.junit.Test;

public class OperatorsTest {

	private static Value n(double d) {
		return Value.number(d);
	}

	private static void assertError(RuntimeErrorKind kind, Runnable action) {
		try {
			action.run();
			fail("Expected " + kind);
		} catch (TwRuntimeException e) {
			assertEquals(kind, e.getKind());
		}
	}

	@Test
	public void testArithmetic() {
		assertEquals(n(5), Operators.add(n(2), n(3)));
		assertEquals(Value.text("ab"), Operators.add(Value.text("a"), Value.text("b")));
		assertEquals(n(2.5), Operators.divide(n(5), n(2)));
		assertEquals(n(-3), Operators.intDivide(n(-7), n(2)));
		assertEquals(n(-1), Operators.modulo(n(-7), n(3)));
		assertEquals(n(8), Operators.power(n(2), n(3)));
		assertEquals(n(-4), Operators.negate(n(4)));
	}

	@Test
	public void testArithmeticErrors() {
		assertError(RuntimeErrorKind.DIVISION_BY_ZERO, () -> Operators.divide(n(1), n(0)));
		assertError(RuntimeErrorKind.DIVISION_BY_ZERO, () -> Operators.intDivide(n(1), n(0)));
		assertError(RuntimeErrorKind.DIVISION_BY_ZERO, () -> Operators.modulo(n(1), n(0)));
		assertError(RuntimeErrorKind.TYPE_MISMATCH, () -> Operators.add(n(1), Value.text("x")));
		assertError(RuntimeErrorKind.TYPE_MISMATCH, () -> Operators.subtract(Value.text("x"), n(1)));
	}

	@Test
	public void testComparisons() {
		assertTrue(Operators.compare(n(1), n(2)) < 0);
		assertTrue(Operators.compare(Value.text("b"), Value.text("a")) > 0);
		assertTrue(Operators.equal(Value.bool(true), Value.bool(true)));
		assertFalse(Operators.equal(n(1), n(2)));
		assertError(RuntimeErrorKind.TYPE_MISMATCH, () -> Operators.compare(n(1), Value.text("1")));
		assertError(RuntimeErrorKind.TYPE_MISMATCH, () -> Operators.equal(n(1), Value.text("1")));
	}

	@Test
	public void testLogic() {
		assertEquals(Value.bool(false), Operators.not(n(3)));
		assertEquals(Value.bool(true), Operators.and(Value.bool(true), n(1)));
		assertEquals(Value.bool(true), Operators.or(n(0), Value.bool(true)));
		assertError(RuntimeErrorKind.TYPE_MISMATCH, () -> Operators.not(Value.text("yes")));
	}

	@Test
	public void testIndexes() {
		assertEquals(3, Operators.toIndex(n(3)));
		assertError(RuntimeErrorKind.INDEX_OUT_OF_RANGE, () -> Operators.toIndex(n(1.5)));
	}

	@Test
	public void testParseNumber() {
		assertEquals(Double.valueOf(42), Operators.parseNumber(" 42 "));
		assertEquals(Double.valueOf(-2.5), Operators.parseNumber("-2.5"));
		assertEquals(Double.valueOf(1000), Operators.parseNumber("1e3"));
		assertNull(Operators.parseNumber(""));
		assertNull(Operators.parseNumber("abc"));
		assertNull(Operators.parseNumber("1d"));
		assertNull(Operators.parseNumber("NaN"));
		assertNull(Operators.parseNumber(null));
	}

	@Test
	public void testFormatting() {
		assertEquals("3", Value.formatNumber(3));
		assertEquals("-7", Value.formatNumber(-7));
		assertEquals("2.5", Value.formatNumber(2.5));
		assertEquals("0.3", Value.formatNumber(0.1 + 0.2));
		assertEquals("0.333333333333333", Value.formatNumber(1d / 3));
		assertEquals("1E+20", Value.formatNumber(1e20));
		assertEquals("TRUE", Value.bool(true).format());
		assertEquals("[1, a]", Value.list(Arrays.asList(n(1), Value.text("a"))).format());
	}

	@Test
	public void testListsAreCopiedOnWrite() {
		Value list = Value.filledList(3, n(0));
		Value updated = list.with(1, n(9));
		assertEquals(n(0), list.get(1));
		assertEquals(n(9), updated.get(1));
		assertEquals(3, updated.size());
		assertError(RuntimeErrorKind.INDEX_OUT_OF_RANGE, () -> list.get(3));
	}

	@Test
	public void testTypedAccessors() {
		assertError(RuntimeErrorKind.TYPE_MISMATCH, () -> Value.text("x").asNumber());
		assertEquals("text \"x\"", Value.text("x").describe());
		assertEquals("number 2", n(2).describe());
	}
}
