package org.metricshub.timewarp.jrt.prolog;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class BindingsTest {

	private static final Atom A = new Atom("a");
	private static final Atom B = new Atom("b");

	@Test
	public void testUnifyBindsBothSides() {
		Bindings bindings = new Bindings(false);
		Variable x = new Variable("X");
		Variable y = new Variable("Y");
		assertTrue(bindings.unify(new Struct("f", x, B), new Struct("f", A, y)));
		assertEquals(A, x.deref());
		assertEquals(B, y.deref());
		assertEquals(2, bindings.mark());
	}

	@Test
	public void testUnifyIsSymmetric() {
		Variable x = new Variable("X");
		assertTrue(new Bindings(false).unify(A, x));
		assertEquals(A, x.deref());
		Variable y = new Variable("Y");
		assertTrue(new Bindings(false).unify(y, A));
		assertEquals(A, y.deref());
	}

	@Test
	public void testMismatches() {
		Bindings bindings = new Bindings(false);
		assertFalse(bindings.unify(new Struct("f", A), new Struct("f", B)));
		assertFalse(bindings.unify(new Struct("f", A), new Struct("f", A, A)));
		assertFalse(bindings.unify(new Struct("f", A), new Struct("g", A)));
		assertFalse(bindings.unify(ValueTerm.number(1), ValueTerm.text("1")));
		assertTrue(bindings.unify(ValueTerm.number(2), ValueTerm.number(2)));
	}

	@Test
	public void testRepeatedVariable() {
		Bindings bindings = new Bindings(false);
		Variable x = new Variable("X");
		int mark = bindings.mark();
		assertFalse(bindings.unify(new Struct("f", x, x), new Struct("f", A, B)));
		bindings.undo(mark);
		assertFalse(x.isBound());
	}

	@Test
	public void testUndoAndUnifiable() {
		Bindings bindings = new Bindings(false);
		Variable x = new Variable("X");
		assertTrue(bindings.unifiable(x, A));
		assertFalse(x.isBound());

		int mark = bindings.mark();
		bindings.unify(x, A);
		assertTrue(x.isBound());
		bindings.undo(mark);
		assertFalse(x.isBound());
		assertEquals(mark, bindings.mark());
	}

	@Test
	public void testOccursCheck() {
		Variable x = new Variable("X");
		Bindings checked = new Bindings(true);
		assertTrue(checked.isOccursCheck());
		assertFalse(checked.unify(x, new Struct("f", x)));
		assertFalse(x.isBound());

		Bindings unchecked = new Bindings(false);
		assertTrue(unchecked.unify(x, new Struct("f", x)));
	}

	@Test
	public void testLongListsDoNotRecurse() {
		List<Term> left = new ArrayList<Term>();
		List<Term> right = new ArrayList<Term>();
		for (int i = 0; i < 100000; i++) {
			left.add(ValueTerm.number(i));
			right.add(new Variable(null));
		}
		Bindings bindings = new Bindings(true);
		assertTrue(bindings.unify(Struct.list(left, Atom.NIL), Struct.list(right, Atom.NIL)));
		assertEquals(99999.0, ((ValueTerm) right.get(99999).deref()).getValue().asNumber(), 0.0);
	}
}
