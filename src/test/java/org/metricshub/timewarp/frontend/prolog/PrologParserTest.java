package org.metricshub.timewarp.frontend.prolog;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import org.junit.Test;
import org.metricshub.timewarp.frontend.LexerException;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.jrt.prolog.Atom;
import org.metricshub.timewarp.jrt.prolog.Struct;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.jrt.prolog.Terms;
import org.metricshub.timewarp.jrt.prolog.ValueTerm;
import org.metricshub.timewarp.jrt.prolog.Variable;

public class PrologParserTest {

	private static PrologProgram parse(String... lines) {
		return new PrologParser("test.tpr").parse(String.join("\n", lines) + "\n");
	}

	private static ParserException parseError(String... lines) {
		try {
			parse(lines);
		} catch (ParserException e) {
			return e;
		}
		fail("Accepted");
		return null;
	}

	private static Term argOfFirstFact(PrologProgram program, String key, int arg) {
		return ((Struct) program.getClauses(key).get(0).getHead()).getArg(arg);
	}

	@Test
	public void testClausesAndDirectives() {
		PrologProgram program = parse(
				"% family",
				"parent(tom, bob).",
				"parent(bob, ann).",
				"/* rules */",
				"grandparent(X, Z) :- parent(X, Y), parent(Y, Z).",
				"?- grandparent(tom, W).",
				":- halt.");
		List<Clause> parents = program.getClauses("parent/2");
		assertEquals(2, parents.size());
		assertTrue(parents.get(0).isFact());
		assertEquals(2, parents.get(0).getLine());
		Clause rule = program.getClauses("grandparent/2").get(0);
		assertFalse(rule.isFact());
		assertEquals(",/2", Terms.key(rule.getBody()));
		assertEquals(2, program.getGoals().size());
		assertEquals("halt/0", Terms.key(program.getGoals().get(1)));
		assertNull(program.getClauses("missing/0"));
		assertTrue(program.getPredicates().contains("grandparent/2"));
	}

	@Test
	public void testVariablesAreSharedWithinAClause() {
		PrologProgram program = parse("same(X, X).", "other(X, _, _).");
		assertSame(argOfFirstFact(program, "same/2", 0), argOfFirstFact(program, "same/2", 1));
		Term first = argOfFirstFact(program, "other/3", 1);
		Term second = argOfFirstFact(program, "other/3", 2);
		assertTrue(first instanceof Variable);
		assertFalse(first == second);
	}

	@Test
	public void testOperatorPriorities() {
		PrologProgram program = parse("?- X is 1 + 2 * 3 - 4.", "?- Y = a - -1.", "?- Z = - 1.");
		Struct is = (Struct) program.getGoals().get(0);
		assertEquals("is", is.getName());
		assertEquals("1+2*3-4", is.getArg(1).toString());
		Struct minus = (Struct) ((Struct) program.getGoals().get(1)).getArg(1);
		assertEquals("-", minus.getName());
		assertEquals(-1.0, ((ValueTerm) minus.getArg(1)).getValue().asNumber(), 0.0);
		Term negated = ((Struct) program.getGoals().get(2)).getArg(1);
		assertTrue(negated instanceof Struct);
		assertEquals("-/1", Terms.key(negated));
	}

	@Test
	public void testLiterals() {
		PrologProgram program = parse("p('it''s', \"two words\", [a, b | T], 2.5, 'Big').");
		Struct head = (Struct) program.getClauses("p/5").get(0).getHead();
		assertEquals(new Atom("it's"), head.getArg(0));
		assertTrue(head.getArg(1) instanceof ValueTerm);
		assertEquals("two words", head.getArg(1).toString());
		assertTrue(((Struct) head.getArg(2)).isListCell());
		assertTrue(Terms.openTail(head.getArg(2)) instanceof Variable);
		assertEquals("2.5", head.getArg(3).toString());
		assertEquals(new Atom("Big"), head.getArg(4));
	}

	@Test
	public void testSections() {
		PrologProgram program = parse(
				"DOMAINS",
				"  person = symbol",
				"PREDICATES",
				"  likes(person, person)",
				"CLAUSES",
				"  likes(ann, tea).",
				"GOAL",
				"  likes(ann, X).");
		assertEquals(1, program.getClauses("likes/2").size());
		assertEquals(1, program.getGoals().size());
	}

	@Test
	public void testMissingFullStop() {
		ParserException e = parseError("p(a)", "p(b).");
		assertEquals("Expected '.' but found 'p'", e.getReason());
		assertEquals(2, e.getLine());
		assertEquals(1, e.getColumn());
	}

	@Test
	public void testInvalidClauses() {
		assertEquals("Cannot redefine the control construct ,/2", parseError("(a, b) :- true.").getReason());
		assertTrue(parseError("p :- 3.").getReason().startsWith("Clause body is not callable"));
		assertTrue(parseError("3 :- p.").getReason().startsWith("Clause head must be"));
	}

	@Test(expected = LexerException.class)
	public void testUnterminatedQuotedAtom() {
		parse("p('abc).");
	}
}
