package org.metricshub.timewarp.jsr223;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Time Warp
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.LanguageKind;
import org.metricshub.timewarp.TimeWarp;
import org.metricshub.timewarp.Transcript;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.util.ProgramSource;

/**
 * JSR-223 script engine running a Time Warp program to its end.
 * <p>
 * The {@code language} attribute of the context ({@code basic},
 * {@code pascal} or {@code prolog}) selects the language; without it the
 * language is guessed from the text. The {@code input} attribute, a string
 * of lines or a list of strings, answers the program's input requests.
 * The output is written to the context writer and returned.
 */
public class TimeWarpScriptEngine extends AbstractScriptEngine {

	/** Context attribute selecting the language. */
	public static final String LANGUAGE_ATTRIBUTE = "language";

	/** Context attribute holding the input lines. */
	public static final String INPUT_ATTRIBUTE = "input";

	private final ScriptEngineFactory factory;

	public TimeWarpScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		String description = description(context);
		try {
			String source = new ProgramSource(description, scriptReader).readText();
			LanguageKind language = language(context, source);
			Transcript transcript = new TimeWarp().run(language, source, inputLines(context));
			String out = transcript.getOutput();
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
			ExecutionEvent terminal = transcript.getTerminalEvent();
			if (terminal instanceof ExecutionEvent.RuntimeError) {
				ExecutionEvent.RuntimeError error = (ExecutionEvent.RuntimeError) terminal;
				throw new ScriptException(error.getMessage(), description, error.getLineNumber());
			}
			return out;
		} catch (ParserException e) {
			throw new ScriptException(e.getReason(), description, e.getLine(), e.getColumn());
		} catch (IOException | IllegalArgumentException e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}

	private static String description(ScriptContext context) {
		Object fileName = context.getAttribute(ScriptEngine.FILENAME);
		return fileName == null ? ProgramSource.DESCRIPTION_EDITOR_BUFFER : fileName.toString();
	}

	private static LanguageKind language(ScriptContext context, String source) {
		Object name = context.getAttribute(LANGUAGE_ATTRIBUTE);
		if (name != null) {
			return LanguageKind.fromName(name.toString());
		}
		Object fileName = context.getAttribute(ScriptEngine.FILENAME);
		if (fileName != null) {
			LanguageKind fromFile = LanguageKind.fromFileName(fileName.toString());
			if (fromFile != null) {
				return fromFile;
			}
		}
		return LanguageKind.detect(source);
	}

	private static List<String> inputLines(ScriptContext context) {
		Object input = context.getAttribute(INPUT_ATTRIBUTE);
		if (input == null) {
			return Collections.emptyList();
		}
		if (input instanceof List) {
			List<String> lines = new ArrayList<String>();
			for (Object line : (List<?>) input) {
				lines.add(String.valueOf(line));
			}
			return lines;
		}
		String text = input.toString();
		if (text.isEmpty()) {
			return Collections.emptyList();
		}
		return Arrays.asList(text.split("\\r?\\n", -1));
	}
}
