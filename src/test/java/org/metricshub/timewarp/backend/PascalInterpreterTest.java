package org.metricshub.timewarp.backend;

import static org.junit.Assert.assertEquals;
import static org.metricshub.timewarp.TwTestSupport.programTest;

import org.junit.Test;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.Transcript;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;

public class PascalInterpreterTest {

	@Test
	public void testWriteFormats() {
		programTest("width and decimals")
				.pascal("begin", "  writeln('x=', 3:4, 2.5:8:2);", "  write('a');", "  write('b');", "  writeln", "end.")
				.expectLines("x=   3    2.50", "ab")
				.runAndAssert();
	}

	@Test
	public void testArithmetic() {
		programTest("div, mod and real division")
				.pascal(
						"var a, b: integer;",
						"    r: real;",
						"begin",
						"  a := 17 div 5;",
						"  b := 17 mod 5;",
						"  r := 17 / 4;",
						"  writeln(a, ' ', b, ' ', r, ' ', sqr(3), ' ', round(2.5), ' ', trunc(-2.7))",
						"end.")
				.expectLines("3 2 4.25 9 3 -2")
				.runAndAssert();
	}

	@Test
	public void testIntegerVariableRejectsFraction() {
		programTest("7 / 2 into an integer")
				.pascal("var a: integer;", "begin", "  a := 7 / 2", "end.")
				.expectError(RuntimeErrorKind.TYPE_MISMATCH)
				.runAndAssert();
	}

	@Test
	public void testBooleans() {
		programTest("boolean expressions")
				.pascal(
						"var ok: boolean;",
						"begin",
						"  ok := (3 > 2) and not (1 = 2);",
						"  writeln(ok, ' ', odd(3) or false)",
						"end.")
				.expectLines("TRUE TRUE")
				.runAndAssert();
	}

	@Test
	public void testLoops() {
		programTest("for to and downto")
				.pascal(
						"var i: integer;",
						"begin",
						"  for i := 1 to 3 do write(i);",
						"  writeln;",
						"  for i := 3 downto 1 do write(i);",
						"  writeln",
						"end.")
				.expectLines("123", "321")
				.runAndAssert();
		programTest("undeclared for variable is local to the loop")
				.pascal("begin", "  for k := 1 to 2 do writeln(k * 10)", "end.")
				.expectLines("10", "20")
				.runAndAssert();
		programTest("while and repeat")
				.pascal(
						"var n, total: integer;",
						"begin",
						"  n := 0;",
						"  total := 0;",
						"  while n < 4 do",
						"  begin",
						"    n := n + 1;",
						"    total := total + n",
						"  end;",
						"  repeat",
						"    n := n - 1",
						"  until n = 0;",
						"  writeln(total, ' ', n)",
						"end.")
				.expectLines("10 0")
				.runAndAssert();
	}

	@Test
	public void testCase() {
		programTest("case with ranges, lists and else")
				.pascal(
						"var i: integer;",
						"begin",
						"  for i := 1 to 5 do",
						"    case i of",
						"      1: writeln('one');",
						"      2, 3: writeln('few');",
						"      4..4: writeln('four')",
						"    else",
						"      writeln('many')",
						"    end",
						"end.")
				.expectLines("one", "few", "few", "four", "many")
				.runAndAssert();
	}

	@Test
	public void testVarParameters() {
		programTest("swap through var parameters")
				.pascal(
						"var x, y: integer;",
						"procedure swap(var a, b: integer);",
						"var t: integer;",
						"begin",
						"  t := a; a := b; b := t",
						"end;",
						"begin",
						"  x := 1; y := 2;",
						"  swap(x, y);",
						"  writeln(x, ',', y)",
						"end.")
				.expectLines("2,1")
				.runAndAssert();
	}

	@Test
	public void testValueParametersAreCopies() {
		programTest("value parameter")
				.pascal(
						"var x: integer;",
						"procedure bump(n: integer);",
						"begin",
						"  n := n + 1;",
						"  writeln(n)",
						"end;",
						"begin",
						"  x := 1;",
						"  bump(x);",
						"  writeln(x)",
						"end.")
				.expectLines("2", "1")
				.runAndAssert();
	}

	@Test
	public void testArrays() {
		programTest("sum of an array")
				.pascal(
						"const N = 4;",
						"var a: array[0..N] of integer;",
						"    i, s: integer;",
						"begin",
						"  for i := 0 to N do a[i] := i * i;",
						"  s := 0;",
						"  for i := 0 to N do s := s + a[i];",
						"  inc(a[1], 10);",
						"  writeln(s, ' ', a[1])",
						"end.")
				.expectLines("30 11")
				.runAndAssert();
		programTest("index out of range")
				.pascal("var a: array[0..2] of integer;", "begin", "  a[3] := 1", "end.")
				.expectError(RuntimeErrorKind.INDEX_OUT_OF_RANGE)
				.runAndAssert();
	}

	@Test
	public void testStrings() {
		programTest("string functions")
				.pascal(
						"var s: string;",
						"    c: char;",
						"begin",
						"  s := 'Time' + ' ' + 'Warp';",
						"  c := s[6];",
						"  writeln(length(s), ' ', c, ' ', copy(s, 1, 4), ' ', pos('Warp', s), ' ', upcase(s))",
						"end.")
				.expectLines("9 W Time 6 TIME WARP")
				.runAndAssert();
	}

	@Test
	public void testIncDecAndConstants() {
		programTest("inc and dec")
				.pascal(
						"const step = 5;",
						"var n: integer;",
						"begin",
						"  n := 10;",
						"  inc(n);",
						"  dec(n, step);",
						"  writeln(n)",
						"end.")
				.expectLines("6")
				.runAndAssert();
	}

	@Test
	public void testReadln() {
		Transcript transcript = programTest("typed input with a retry")
				.pascal(
						"var n: integer;",
						"    name: string;",
						"begin",
						"  write('n? ');",
						"  readln(n);",
						"  readln(name);",
						"  writeln(name, ' ', n * 2)",
						"end.")
				.input("abc", "21", "Ada")
				.expectOutput("n? Ada 42\n")
				.runAndAssert();
		assertEquals(3, transcript.getInputRequestCount());
		ExecutionEvent first = transcript.getEvents().get(0);
		assertEquals("n? ", ((ExecutionEvent.Output) first).getText());
	}

	@Test
	public void testFunctionWithoutResult() {
		programTest("function never assigns its result")
				.pascal("function f: integer;", "begin", "end;", "begin", "  writeln(f)", "end.")
				.expectError(RuntimeErrorKind.MISSING_RESULT)
				.runAndAssert();
	}

	@Test
	public void testRunawayRecursion() {
		programTest("endless recursion")
				.pascal("procedure p;", "begin", "  p", "end;", "begin", "  p", "end.")
				.expectError(RuntimeErrorKind.STACK_OVERFLOW)
				.runAndAssert();
	}

	@Test
	public void testHalt() {
		programTest("halt stops the program")
				.pascal("begin", "  writeln('a');", "  halt;", "  writeln('b')", "end.")
				.expectLines("a")
				.expectCompletion(ExecutionEvent.CompletionReason.HALTED)
				.runAndAssert();
	}

	@Test
	public void testMutualStyleRecursionWithLocals() {
		programTest("fibonacci keeps one frame per call")
				.pascal(
						"function fib(n: integer): integer;",
						"var a, b: integer;",
						"begin",
						"  if n < 2 then fib := n",
						"  else begin",
						"    a := fib(n - 1);",
						"    b := fib(n - 2);",
						"    fib := a + b",
						"  end",
						"end;",
						"begin",
						"  writeln(fib(10))",
						"end.")
				.expectLines("55")
				.runAndAssert();
	}
}
