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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.timewarp.frontend.basic.BasicProgram;
import org.metricshub.timewarp.jrt.Value;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Continuation of a TW BASIC run: global variables, the {@code GOSUB},
 * {@code FOR} and {@code REPEAT} stacks, the PILOT answer and match flag,
 * and the pending {@code INPUT} or {@code A:} while suspended.
 */
public class BasicExecutionState extends TupleExecutionState {

	/** An active {@code FOR} loop. */
	static final class ForLoop {
		final String variable;
		final double limit;
		final double step;
		final int body;

		ForLoop(String variable, double limit, double step, int body) {
			this.variable = variable;
			this.limit = limit;
			this.step = step;
			this.body = body;
		}

		boolean isDone(double value) {
			return step >= 0 ? value > limit : value < limit;
		}
	}

	private final Map<String, Value> variables = new HashMap<String, Value>();
	private final Map<String, Value> arrays = new HashMap<String, Value>();
	private final Deque<Integer> returnStack = new ArrayDeque<Integer>();
	private final List<ForLoop> forLoops = new ArrayList<ForLoop>();
	private final Deque<Long> repeatCounters = new ArrayDeque<Long>();

	private String answer = "";
	private boolean matched;
	private String pendingPrompt;
	private int column;

	private String inputVariable;
	private boolean inputIsAnswer;

	BasicExecutionState(BasicProgram program, TwSettings settings) {
		super(program, program.getTuples(), settings);
	}

	public BasicProgram getBasicProgram() {
		return (BasicProgram) getProgram();
	}

	/**
	 * @param name upper-case variable name
	 * @return the current value, or {@code null} when never assigned
	 */
	public Value getVariable(String name) {
		return variables.get(name);
	}

	void setVariable(String name, Value value) {
		variables.put(name, value);
	}

	Value getArray(String name) {
		return arrays.get(name);
	}

	void setArray(String name, Value value) {
		arrays.put(name, value);
	}

	Deque<Integer> getReturnStack() {
		return returnStack;
	}

	List<ForLoop> getForLoops() {
		return forLoops;
	}

	Deque<Long> getRepeatCounters() {
		return repeatCounters;
	}

	/**
	 * @return the last answer given to a PILOT {@code A:}
	 */
	public String getAnswer() {
		return answer;
	}

	void setAnswer(String answer) {
		this.answer = answer;
	}

	public boolean isMatched() {
		return matched;
	}

	void setMatched(boolean matched) {
		this.matched = matched;
	}

	String takePendingPrompt() {
		String prompt = pendingPrompt;
		pendingPrompt = null;
		return prompt;
	}

	void setPendingPrompt(String pendingPrompt) {
		this.pendingPrompt = pendingPrompt;
	}

	/** Column of the output cursor, used for print zones. */
	int getColumn() {
		return column;
	}

	void setColumn(int column) {
		this.column = column;
	}

	void awaitInput(String variable, boolean answer) {
		this.inputVariable = variable;
		this.inputIsAnswer = answer;
	}

	String getInputVariable() {
		return inputVariable;
	}

	boolean isInputAnswer() {
		return inputIsAnswer;
	}
}
