package org.metricshub.timewarp.backend;

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

import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Runs one kind of {@link Program} in small, resumable slices.
 * <p>
 * Implementations keep all of a run in the {@link ExecutionState} they
 * create, so that {@link #execute(ExecutionState)} can return to the host
 * as soon as there is something to report and pick up where it left off on
 * the next call.
 */
public interface Interpreter {

	/**
	 * Creates the initial state of a run: turtle at home, empty environment,
	 * execution pointer on the first statement.
	 *
	 * @param program the program to run
	 * @param settings run parameters
	 * @return the new state
	 */
	ExecutionState start(Program program, TwSettings settings);

	/**
	 * Executes until at least one event is queued, input is requested, the
	 * run ends or the abort flag is raised.
	 *
	 * @param state the run
	 * @throws org.metricshub.timewarp.jrt.TwRuntimeException when the program fails
	 */
	void execute(ExecutionState state);

	/**
	 * Hands the host's answer to the construct that requested input. When
	 * the text cannot be converted to the expected type, the same request
	 * is queued again.
	 *
	 * @param state the suspended run
	 * @param text raw input text
	 * @throws org.metricshub.timewarp.jrt.TwRuntimeException when the program fails
	 */
	void provideInput(ExecutionState state, String text);
}
