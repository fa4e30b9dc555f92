package org.metricshub.timewarp.backend;

import static org.junit.Assert.assertEquals;
import static org.metricshub.timewarp.TwTestSupport.programTest;

import java.util.Collections;
import org.junit.Test;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.LanguageKind;
import org.metricshub.timewarp.TimeWarp;
import org.metricshub.timewarp.TwTestSupport;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;

public class PrologInterpreterTest {

	@Test
	public void testRecursionWithCut() {
		programTest("factorial")
				.prolog(
						"fact(0, 1) :- !.",
						"fact(N, F) :- N1 is N - 1, fact(N1, F1), F is N * F1.",
						"?- fact(5, F), write(F), nl.")
				.expectLines("120")
				.expectCompletion(ExecutionEvent.CompletionReason.NO_MORE_SOLUTIONS)
				.runAndAssert();
	}

	@Test
	public void testCutCommitsToClause() {
		programTest("max with cut")
				.prolog(
						"max(X, Y, X) :- X >= Y, !.",
						"max(_, Y, Y).",
						"?- max(3, 5, M), write(M), nl.",
						"?- max(7, 5, M), write(M), nl.")
				.expectLines("5", "7")
				.runAndAssert();
	}

	@Test
	public void testLibraryPredicatesEnumerate() {
		programTest("member")
				.prolog("?- member(X, [a, b, c]), write(X), nl.")
				.expectLines("a", "b", "c")
				.runAndAssert();
		programTest("append splits a list")
				.prolog("?- append(X, Y, [1, 2]), write(X-Y), nl.")
				.expectLines("[]-[1,2]", "[1]-[2]", "[1,2]-[]")
				.runAndAssert();
		programTest("between and nth0")
				.prolog("?- between(1, 3, X), nth0(X, [a, b, c, d], E), write(X-E), write(' '), fail ; nl.")
				.expectLines("1-b 2-c 3-d ")
				.runAndAssert();
	}

	@Test
	public void testBacktrackingIntoLaterClauses() {
		programTest("facts in clause order")
				.prolog("person(john).", "person(mary).", "?- person(X), write(X), nl.")
				.expectLines("john", "mary")
				.expectCompletion(ExecutionEvent.CompletionReason.NO_MORE_SOLUTIONS)
				.runAndAssert();
		programTest("failing test retries the next fact")
				.prolog("p(1).", "p(2).", "p(3).", "?- p(X), X > 1, write(X), nl.")
				.expectLines("2", "3")
				.runAndAssert();
		programTest("findall over facts")
				.prolog("c(red).", "c(green).", "?- findall(X, c(X), L), write(L), nl.")
				.expectLines("[red,green]")
				.runAndAssert();
	}

	@Test
	public void testUserDefinitionOverridesLibrary() {
		programTest("own member/2")
				.prolog("member(only, _).", "?- member(X, [a, b]), write(X), nl.")
				.expectLines("only")
				.runAndAssert();
	}

	@Test
	public void testFindall() {
		programTest("collects in order")
				.prolog(
						"?- findall(X, member(X, [3, 1, 2]), L), write(L), nl.",
						"?- findall(X, member(X, []), L), write(L), nl.",
						"?- findall(X-Y, (member(X, [1, 2]), Y is X * X), L), write(L), nl.")
				.expectLines("[3,1,2]", "[]", "[1-1,2-4]")
				.runAndAssert();
	}

	@Test
	public void testNegationAndIfThenElse() {
		programTest("negation as failure")
				.prolog("?- \\+ member(d, [a, b]), write(yes), nl.", "?- not(member(a, [a])), write(no), nl.")
				.expectLines("yes")
				.runAndAssert();
		programTest("if then else takes the first condition solution only")
				.prolog(
						"?- (1 < 2 -> write(lt) ; write(ge)), nl.",
						"?- (member(X, [a, b]) -> write(X) ; write(none)), nl.")
				.expectLines("lt", "a")
				.runAndAssert();
	}

	@Test
	public void testDisjunction() {
		programTest("both branches")
				.prolog("?- (X = left ; X = right), write(X), nl.")
				.expectLines("left", "right")
				.runAndAssert();
	}

	@Test
	public void testArithmeticAndComparison() {
		programTest("integer operators")
				.prolog(
						"?- X is 7 // 2, Y is 7 mod 3, Z is 2 ** 3, W is -(4) + abs(-1), write(X/Y/Z/W), nl.",
						"?- X is 7 / 2, write(X), nl.",
						"?- 3 =:= 1 + 2, 2 < 3, 3 >= 3, 1 =\\= 2, write(ok), nl.")
				.expectLines("3/1/8/-3", "3.5", "ok")
				.runAndAssert();
		programTest("unbound arithmetic")
				.prolog("?- X is Y + 1.")
				.expectError(RuntimeErrorKind.INSTANTIATION)
				.runAndAssert();
		programTest("division by zero")
				.prolog("?- X is 1 / 0.")
				.expectError(RuntimeErrorKind.DIVISION_BY_ZERO)
				.runAndAssert();
	}

	@Test
	public void testUnificationAndIdentity() {
		programTest("structures")
				.prolog(
						"?- f(X, b) = f(a, Y), write(X/Y), nl.",
						"?- f(a) \\= f(b), a == a, X \\== Y, write(ok), nl.",
						"?- [H|T] = [1, 2, 3], write(H), write(' '), write(T), nl.")
				.expectLines("a/b", "ok", "1 [2,3]")
				.runAndAssert();
	}

	@Test
	public void testOccursCheck() {
		programTest("occurs check off")
				.prolog("?- (X = f(X) -> write(yes) ; write(no)), nl.")
				.expectLines("yes")
				.runAndAssert();
		programTest("occurs check on")
				.prolog("?- (X = f(X) -> write(yes) ; write(no)), nl.")
				.occursCheck()
				.expectLines("no")
				.runAndAssert();
	}

	@Test
	public void testListBuiltins() {
		programTest("length and reverse")
				.prolog(
						"?- length([a, b, c], N), reverse([1, 2, 3], R), write(N), write(' '), write(R), nl.",
						"?- length(L, 2), L = [x, y], write(L), nl.")
				.expectLines("3 [3,2,1]", "[x,y]")
				.runAndAssert();
	}

	@Test
	public void testTypeChecks() {
		programTest("var, atom, number, integer, is_list")
				.prolog("?- var(X), atom(a), number(2.5), integer(3), is_list([]), nonvar(f(X)), write(ok), nl.")
				.expectLines("ok")
				.runAndAssert();
	}

	@Test
	public void testUndefinedPredicate() {
		programTest("unknown goal")
				.prolog("?- missing(1).")
				.expectError(RuntimeErrorKind.UNDEFINED_PREDICATE)
				.runAndAssert();
	}

	@Test
	public void testReadln() {
		programTest("text input")
				.prolog("?- write('Name? '), readln(N), write(hello(N)), nl.")
				.input("Ann")
				.expectOutput("Name? hello(Ann)\n")
				.runAndAssert();
		programTest("integer input with a retry")
				.prolog("?- readint(N), M is N * 2, write(M), nl.")
				.input("x", "2.5", "4")
				.expectLines("8")
				.runAndAssert();
	}

	@Test
	public void testTurboPrologSections() {
		programTest("domains, predicates, clauses and goal")
				.prolog(
						"domains",
						"  name = symbol",
						"predicates",
						"  likes(name, name)",
						"clauses",
						"  likes(ann, books).",
						"  likes(bob, music).",
						"goal",
						"  likes(ann, X), write(X), nl.")
				.expectLines("books")
				.runAndAssert();
	}

	@Test
	public void testHalt() {
		programTest("halt ends all directives")
				.prolog("?- write(a), nl, halt.", "?- write(b), nl.")
				.expectLines("a")
				.expectCompletion(ExecutionEvent.CompletionReason.HALTED)
				.runAndAssert();
	}

	@Test
	public void testLongRecursionDoesNotUseTheJavaStack() {
		programTest("count down from 100000")
				.prolog("count(0).", "count(N) :- N > 0, N1 is N - 1, count(N1).", "?- count(100000), write(done), nl.")
				.expectLines("done")
				.runAndAssert();
	}

	@Test
	public void testSolutionsAreCounted() {
		TimeWarp timeWarp = new TimeWarp();
		ExecutionState state = timeWarp
				.start(timeWarp.load(LanguageKind.PROLOG, TwTestSupport.lines("p(1).", "p(2).", "p(3).", "?- p(X).")));
		timeWarp.run(state, Collections.<String>emptyList());
		assertEquals(3L, ((PrologExecutionState) state).getSolutionCount());
		assertEquals(0, ((PrologExecutionState) state).getChoicePointCount());
	}
}
