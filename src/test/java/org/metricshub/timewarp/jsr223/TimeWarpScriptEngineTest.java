package org.metricshub.timewarp.jsr223;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringWriter;
import java.util.Arrays;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import org.junit.Before;
import org.junit.Test;

public class TimeWarpScriptEngineTest {

	private ScriptEngine engine;
	private StringWriter writer;

	@Before
	public void setUp() {
		engine = new ScriptEngineManager().getEngineByName("twbasic");
		assertNotNull("engine registered as twbasic", engine);
		writer = new StringWriter();
		engine.getContext().setWriter(writer);
	}

	@Test
	public void testEvalWritesAndReturnsOutput() throws ScriptException {
		Object result = engine.eval("10 PRINT \"HI\"\n20 PRINT 6 * 7\n");
		assertEquals("HI\n42\n", result);
		assertEquals("HI\n42\n", writer.toString());
	}

	@Test
	public void testLanguageAttribute() throws ScriptException {
		engine.getContext().setAttribute(TimeWarpScriptEngine.LANGUAGE_ATTRIBUTE, "prolog", ScriptContext.ENGINE_SCOPE);
		assertEquals("a\nb\n", engine.eval("p(a).\np(b).\n?- p(X), write(X), nl.\n"));
	}

	@Test
	public void testInputAttribute() throws ScriptException {
		engine.getContext().setAttribute(TimeWarpScriptEngine.INPUT_ATTRIBUTE, "20\n1", ScriptContext.ENGINE_SCOPE);
		assertEquals("21\n", engine.eval("var a, b: integer;\nbegin readln(a); readln(b); writeln(a + b) end.\n"));

		engine.getContext().setAttribute(
				TimeWarpScriptEngine.INPUT_ATTRIBUTE,
				Arrays.asList("Ada"),
				ScriptContext.ENGINE_SCOPE);
		assertEquals("Ada\n", engine.eval("10 INPUT N$\n20 PRINT N$\n"));
	}

	@Test
	public void testSyntaxErrorPosition() {
		try {
			engine.eval("10 PRINT 1\n20 FOR I = 1 TO 2\n");
			fail("Syntax error not reported");
		} catch (ScriptException e) {
			assertEquals(2, e.getLineNumber());
			assertEquals(4, e.getColumnNumber());
			assertTrue(e.getMessage().startsWith("FOR without NEXT"));
		}
	}

	@Test
	public void testRuntimeErrorKeepsOutput() {
		try {
			engine.eval("10 PRINT \"before\"\n20 PRINT 1 / 0\n");
			fail("Runtime error not reported");
		} catch (ScriptException e) {
			assertEquals(20, e.getLineNumber());
			assertEquals("before\n", writer.toString());
		}
	}

	@Test
	public void testFactory() throws ScriptException {
		ScriptEngineFactory factory = engine.getFactory();
		assertTrue(factory.getNames().contains("twprolog"));
		assertTrue(factory.getExtensions().contains("pas"));
		assertEquals("Time Warp", factory.getParameter(ScriptEngine.ENGINE));
		assertEquals("hi\n", engine.eval(factory.getProgram(factory.getOutputStatement("hi"))));
	}
}
