package org.metricshub.timewarp.jrt.prolog;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import org.junit.Test;

public class TermWriterTest {

	private static final Atom A = new Atom("a");
	private static final Atom B = new Atom("b");
	private static final Atom C = new Atom("c");

	private static ValueTerm n(double d) {
		return ValueTerm.number(d);
	}

	@Test
	public void testCompoundsAndLists() {
		assertEquals("f(a,b)", TermWriter.format(new Struct("f", A, B)));
		assertEquals("[1,2,3]", TermWriter.format(Struct.list(Arrays.asList(n(1), n(2), n(3)), Atom.NIL)));
		assertEquals("[]", TermWriter.format(Atom.NIL));
		assertEquals("[a|b]", TermWriter.format(Struct.cons(A, B)));
		assertEquals("f([a],g(b))", TermWriter.format(new Struct("f", Struct.cons(A, Atom.NIL), new Struct("g", B))));
	}

	@Test
	public void testVariables() {
		Variable x = new Variable("X");
		assertEquals("_G" + x.getId(), TermWriter.format(x));
		assertEquals("[a|_G" + x.getId() + "]", TermWriter.format(Struct.cons(A, x)));
	}

	@Test
	public void testValues() {
		assertEquals("2.5", TermWriter.format(n(2.5)));
		assertEquals("3", TermWriter.format(n(3)));
		assertEquals("two words", TermWriter.format(ValueTerm.text("two words")));
	}

	@Test
	public void testOperatorPriorities() {
		assertEquals("1+2*3", TermWriter.format(new Struct("+", n(1), new Struct("*", n(2), n(3)))));
		assertEquals("(1+2)*3", TermWriter.format(new Struct("*", new Struct("+", n(1), n(2)), n(3))));
		assertEquals("a-b-c", TermWriter.format(new Struct("-", new Struct("-", A, B), C)));
		assertEquals("a-(b-c)", TermWriter.format(new Struct("-", A, new Struct("-", B, C))));
		assertEquals("f((a :- b))", TermWriter.format(new Struct("f", new Struct(":-", A, B))));
	}

	@Test
	public void testOperatorSpacing() {
		assertEquals("7 mod 2", TermWriter.format(new Struct("mod", n(7), n(2))));
		assertEquals("a :- b", TermWriter.format(new Struct(":-", A, B)));
		assertEquals("a -> b", TermWriter.format(new Struct("->", A, B)));
		assertEquals("a,b", TermWriter.format(new Struct(",", A, B)));
		assertEquals("-a", TermWriter.format(new Struct("-", A)));
		assertEquals("- 1", TermWriter.format(new Struct("-", n(1))));
		assertEquals("\\+a", TermWriter.format(new Struct("\\+", A)));
	}

	@Test
	public void testDereferencesBindings() {
		Variable x = new Variable("X");
		Bindings bindings = new Bindings(false);
		bindings.unify(x, new Struct("g", A));
		assertEquals("f(g(a))", TermWriter.format(new Struct("f", x)));
		assertEquals("f(g(a))", new Struct("f", x).toString());
	}
}
