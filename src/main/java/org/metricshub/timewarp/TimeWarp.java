package org.metricshub.timewarp;

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
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.metricshub.timewarp.backend.BasicInterpreter;
import org.metricshub.timewarp.backend.Interpreter;
import org.metricshub.timewarp.backend.PascalInterpreter;
import org.metricshub.timewarp.backend.PrologInterpreter;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.frontend.basic.BasicParser;
import org.metricshub.timewarp.frontend.pascal.PascalParser;
import org.metricshub.timewarp.frontend.prolog.PrologParser;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.util.ProgramFileSource;
import org.metricshub.timewarp.util.ProgramSource;
import org.metricshub.timewarp.util.TwLogger;
import org.metricshub.timewarp.util.TwSettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of Time Warp programs, used
 * both when the engine is embedded in a host and from the command line.
 * <p>
 * Running a program goes as follows:
 * <ul>
 * <li>{@link #load(LanguageKind, String)} parses the text into an immutable
 * {@link Program}, or throws a {@link ParserException} with the position of
 * the first syntax error.
 * <li>{@link #start(Program)} creates the {@link ExecutionState} holding
 * everything the run needs to be continued later.
 * <li>{@link #step(ExecutionState)} runs until the program emits an event and
 * returns it. After an {@link ExecutionEvent.InputRequested} event the host
 * calls {@link #resume(ExecutionState, String)} with the text entered.
 * <li>The run ends with a {@link ExecutionEvent.Completed} or
 * {@link ExecutionEvent.RuntimeError} event, returned again by any further
 * {@code step}.
 * </ul>
 * Nothing blocks: between two calls the host is free to render, and the run
 * lives entirely in its {@code ExecutionState}.
 */
public class TimeWarp {

	private static final Logger LOG = TwLogger.getLogger(TimeWarp.class);

	private final TwSettings settings;
	private final Map<LanguageKind, Interpreter> interpreters = new EnumMap<LanguageKind, Interpreter>(
			LanguageKind.class);

	/**
	 * Create a new engine with the default settings
	 */
	public TimeWarp() {
		this(TwSettings.DEFAULT_SETTINGS);
	}

	/**
	 * @param settings settings applied to every run started by this engine
	 */
	public TimeWarp(TwSettings settings) {
		this.settings = settings;
		interpreters.put(LanguageKind.BASIC, new BasicInterpreter());
		interpreters.put(LanguageKind.PASCAL, new PascalInterpreter());
		interpreters.put(LanguageKind.PROLOG, new PrologInterpreter());
	}

	public TwSettings getSettings() {
		return settings;
	}

	/**
	 * Parses a program handed over as text, such as an editor buffer.
	 *
	 * @param language language of the text
	 * @param source program text
	 * @return the parsed program
	 * @throws ParserException on the first syntax error
	 */
	public Program load(LanguageKind language, String source) {
		return load(language, source, ProgramSource.DESCRIPTION_EDITOR_BUFFER);
	}

	/**
	 * Parses a program source. The language is taken from the file name when
	 * it has a known extension, and guessed from the text otherwise.
	 *
	 * @param source the source
	 * @return the parsed program
	 * @throws IOException when the source cannot be read
	 * @throws ParserException on the first syntax error
	 */
	public Program load(ProgramSource source) throws IOException {
		String text = source.readText();
		LanguageKind language = null;
		if (source instanceof ProgramFileSource) {
			language = LanguageKind.fromFileName(((ProgramFileSource) source).getFilePath());
		}
		if (language == null) {
			language = LanguageKind.detect(text);
		}
		return load(language, text, source.getDescription());
	}

	/**
	 * Parses a program source in the given language.
	 *
	 * @param language language of the source
	 * @param source the source
	 * @return the parsed program
	 * @throws IOException when the source cannot be read
	 * @throws ParserException on the first syntax error
	 */
	public Program load(LanguageKind language, ProgramSource source) throws IOException {
		return load(language, source.readText(), source.getDescription());
	}

	private Program load(LanguageKind language, String source, String description) {
		Program program;
		switch (language) {
		case BASIC:
			program = new BasicParser(description).parse(source);
			break;
		case PASCAL:
			program = new PascalParser(description).parse(source);
			break;
		case PROLOG:
			program = new PrologParser(description).parse(source);
			break;
		default:
			throw new IllegalArgumentException("Unsupported language " + language);
		}
		LOG.debug("Loaded {} program from {}", language.getDisplayName(), description);
		return program;
	}

	/**
	 * Prepares a run of the program: fresh variables, turtle at home, empty
	 * output.
	 *
	 * @param program a loaded program
	 * @return the state of the new run
	 */
	public ExecutionState start(Program program) {
		LOG.debug("Starting {}", program.getSourceDescription());
		return interpreter(program).start(program, settings);
	}

	/**
	 * Runs the program until it emits an event.
	 *
	 * @param state the run
	 * @return the next event; once the run has ended, its terminal event
	 * @throws IllegalStateException when the run waits for input
	 */
	public ExecutionEvent step(ExecutionState state) {
		if (state.isAborted()) {
			state.settleAbort();
			return state.getTerminalEvent();
		}
		ExecutionEvent queued = state.getChannel().poll();
		if (queued != null) {
			return queued;
		}
		if (state.isTerminated()) {
			return state.getTerminalEvent();
		}
		if (state.isAwaitingInput()) {
			throw new IllegalStateException("The program is waiting for input; call resume");
		}
		try {
			interpreter(state.getProgram()).execute(state);
		} catch (TwRuntimeException e) {
			LOG.debug("Runtime error in {}: {}", state.getProgram().getSourceDescription(), e.getMessage());
			state.fail(e);
		}
		if (state.isAborted()) {
			state.settleAbort();
			return state.getTerminalEvent();
		}
		ExecutionEvent event = state.getChannel().poll();
		if (event != null) {
			return event;
		}
		if (state.getTerminalEvent() != null) {
			LOG.debug("{} ended: {}", state.getProgram().getSourceDescription(), state.getTerminalEvent());
		}
		return state.getTerminalEvent();
	}

	/**
	 * Supplies the text requested by the last {@link ExecutionEvent.InputRequested}
	 * event and runs on to the next event.
	 *
	 * @param state the run
	 * @param input the text entered, without line terminator
	 * @return the next event
	 * @throws IllegalStateException when no input request has been delivered
	 */
	public ExecutionEvent resume(ExecutionState state, String input) {
		if (!state.getChannel().isInputRequestDelivered()) {
			throw new IllegalStateException("No input request is outstanding");
		}
		state.getChannel().inputSupplied();
		try {
			interpreter(state.getProgram()).provideInput(state, input);
		} catch (TwRuntimeException e) {
			state.fail(e);
		}
		return step(state);
	}

	/**
	 * Asks the run to stop. May be called from any thread; the next
	 * {@link #step(ExecutionState)} returns a {@code Completed} event with
	 * reason {@code ABORTED} and no other event is delivered.
	 *
	 * @param state the run
	 */
	public void abort(ExecutionState state) {
		state.abort();
	}

	/**
	 * Runs a program to its end, answering input requests from a list.
	 * When the list runs out, the run is aborted.
	 *
	 * @param language language of the program
	 * @param source program text
	 * @param inputs answers to the input requests, in order
	 * @return all events of the run
	 * @throws ParserException on the first syntax error
	 */
	public Transcript run(LanguageKind language, String source, List<String> inputs) {
		return run(start(load(language, source)), inputs);
	}

	/**
	 * Drives a started run to its end, answering input requests from a list.
	 *
	 * @param state a run that has not been stepped yet
	 * @param inputs answers to the input requests, in order
	 * @return all events of the run
	 */
	public Transcript run(ExecutionState state, List<String> inputs) {
		List<ExecutionEvent> events = new ArrayList<ExecutionEvent>();
		Iterator<String> answers = inputs.iterator();
		ExecutionEvent event = step(state);
		while (true) {
			events.add(event);
			if (event.isTerminal()) {
				return new Transcript(events);
			}
			if (event instanceof ExecutionEvent.InputRequested) {
				if (answers.hasNext()) {
					event = resume(state, answers.next());
				} else {
					LOG.debug("No input left for {}, aborting", state.getProgram().getSourceDescription());
					abort(state);
					event = step(state);
				}
			} else {
				event = step(state);
			}
		}
	}

	private Interpreter interpreter(Program program) {
		return interpreters.get(program.getLanguage());
	}
}
