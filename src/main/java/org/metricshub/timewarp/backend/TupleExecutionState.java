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
import java.util.Deque;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.intermediate.TupleProgram;
import org.metricshub.timewarp.jrt.Value;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Continuation of a run over instruction tuples: the position of the next
 * instruction and the operand stack.
 */
public abstract class TupleExecutionState extends ExecutionState {

	private final TupleProgram tuples;
	private final Deque<Object> operandStack = new ArrayDeque<Object>();
	private int position;

	protected TupleExecutionState(Program program, TupleProgram tuples, TwSettings settings) {
		super(program, settings);
		this.tuples = tuples;
	}

	public TupleProgram getTuples() {
		return tuples;
	}

	/**
	 * @return index of the next instruction to execute
	 */
	public int getPosition() {
		return position;
	}

	void jump(int index) {
		position = index;
	}

	void next() {
		position++;
	}

	void push(Object o) {
		operandStack.push(o);
	}

	Object pop() {
		return operandStack.pop();
	}

	Value popValue() {
		return (Value) operandStack.pop();
	}

	Object peek() {
		return operandStack.peek();
	}

	int stackSize() {
		return operandStack.size();
	}

	/**
	 * Pops N values, returned in push order.
	 */
	Value[] popValues(int count) {
		Value[] values = new Value[count];
		for (int i = count - 1; i >= 0; i--) {
			values[i] = popValue();
		}
		return values;
	}
}
