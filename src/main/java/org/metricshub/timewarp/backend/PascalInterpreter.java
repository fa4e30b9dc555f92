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

import java.util.List;
import java.util.Locale;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.frontend.pascal.PascalProgram;
import org.metricshub.timewarp.frontend.pascal.PascalType;
import org.metricshub.timewarp.frontend.pascal.Routine;
import org.metricshub.timewarp.intermediate.Tuple;
import org.metricshub.timewarp.jrt.Operators;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Runs compiled TW Pascal programs.
 * <p>
 * Every assignment is checked against the declared type of its target.
 * {@code write} appends to the current output line and {@code writeln}
 * emits it, so a line built by several {@code write} calls reaches the host
 * as a single output event.
 */
public class PascalInterpreter extends TupleInterpreter {

	@Override
	public ExecutionState start(Program program, TwSettings settings) {
		return new PascalExecutionState((PascalProgram) program, settings);
	}

	@Override
	protected void executeTuple(TupleExecutionState executionState, Tuple tuple) {
		PascalExecutionState state = (PascalExecutionState) executionState;
		switch (tuple.getOpcode()) {
		case LOAD_SLOT:
			state.push(state.slot(tuple.getInt(0), tuple.getBoolean(1)).get());
			break;
		case STORE_SLOT:
			state.slot(tuple.getInt(0), tuple.getBoolean(1)).set(state.popValue());
			break;
		case LOAD_INDEXED: {
			// stack[0] = index
			Reference variable = state.slot(tuple.getInt(0), tuple.getBoolean(1));
			int index = Operators.toIndex(state.popValue());
			state.push(element(variable, index));
			break;
		}
		case STORE_INDEXED: {
			// stack[0] = value
			// stack[1] = index
			Value value = state.popValue();
			int index = Operators.toIndex(state.popValue());
			new ElementReference(state.slot(tuple.getInt(0), tuple.getBoolean(1)), index).set(value);
			break;
		}
		case PUSH_REF:
			state.push(state.slot(tuple.getInt(0), tuple.getBoolean(1)));
			break;
		case PUSH_ELEMENT_REF: {
			int index = Operators.toIndex(state.popValue());
			state.push(new ElementReference(state.slot(tuple.getInt(0), tuple.getBoolean(1)), index));
			break;
		}
		case CALL:
			call(state, state.getPascalProgram().getRoutines().get(tuple.getInt(0)));
			break;
		case RETURN_ROUTINE: {
			Frame frame = state.getFrames().pop();
			Routine routine = frame.getRoutine();
			state.jump(frame.getReturnAddress());
			if (routine.isFunction()) {
				if (frame.getResult() == null) {
					throw new TwRuntimeException(
							RuntimeErrorKind.MISSING_RESULT,
							"Function " + routine.getName() + " returned without assigning a result");
				}
				state.push(frame.getResult());
			}
			break;
		}
		case STORE_RESULT: {
			Frame frame = state.getFrames().peek();
			Routine routine = frame.getRoutine();
			frame.setResult(routine.getResultType().coerce(state.popValue(), routine.getName()));
			break;
		}
		case WRITE:
			write(state, (int[]) tuple.getArg(0), tuple.getBoolean(1));
			break;
		case READ:
			state.setPendingRead(tuple.getBoolean(0) ? (Reference) state.pop() : null);
			state.requestInput(null);
			break;
		default:
			throw new IllegalStateException("Unexpected instruction in a Pascal program: " + tuple);
		}
	}

	private static Value element(Reference variable, int index) {
		Value value = variable.get();
		if (value.isText()) {
			String text = value.asText();
			if (index < 1 || index > text.length()) {
				throw new TwRuntimeException(
						RuntimeErrorKind.INDEX_OUT_OF_RANGE,
						"Index " + index + " out of range 1.." + text.length() + " for " + variable.getName());
			}
			return Value.text(text.substring(index - 1, index));
		}
		ElementReference.checkIndex(variable, index);
		return value.get(index);
	}

	private static void call(PascalExecutionState state, Routine routine) {
		int maxDepth = state.getSettings().getMaxCallDepth();
		if (state.getCallDepth() >= maxDepth) {
			throw new TwRuntimeException(
					RuntimeErrorKind.STACK_OVERFLOW,
					"Call depth exceeded " + maxDepth + " in " + routine.getName());
		}
		List<Routine.Parameter> parameters = routine.getParameters();
		List<PascalType> types = routine.getSlotTypes();
		Reference[] slots = new Reference[types.size()];

		// arguments were pushed left to right
		for (int i = parameters.size() - 1; i >= 0; i--) {
			Routine.Parameter parameter = parameters.get(i);
			Object argument = state.pop();
			if (parameter.isByReference()) {
				Reference reference = (Reference) argument;
				if (!sameType(reference.getType(), parameter.getType())) {
					throw new TwRuntimeException(
							RuntimeErrorKind.TYPE_MISMATCH,
							"Cannot pass " + reference.getType() + " " + reference.getName() + " as var parameter "
									+ parameter.getName() + " of type " + parameter.getType());
				}
				slots[i] = reference;
			} else {
				Cell cell = new Cell(parameter.getName(), parameter.getType());
				cell.set((Value) argument);
				slots[i] = cell;
			}
		}
		for (int i = parameters.size(); i < slots.length; i++) {
			slots[i] = new Cell(routine.getSlotName(i), types.get(i));
		}
		state.getFrames().push(new Frame(routine, slots, state.getPosition()));
		state.jump(routine.getEntry().index());
	}

	private static boolean sameType(PascalType actual, PascalType formal) {
		if (actual.isArray() || formal.isArray()) {
			return actual.isArray() && formal.isArray() && actual.getLength() == formal.getLength()
					&& sameType(actual.getElementType(), formal.getElementType());
		}
		return actual.getKind() == formal.getKind() || actual.getKind() == PascalType.Kind.ANY;
	}

	/**
	 * Each item is followed on the stack by its optional width and decimals.
	 */
	private static void write(PascalExecutionState state, int[] formats, boolean lineEnd) {
		int count = 0;
		for (int format : formats) {
			count += 1 + format;
		}
		Value[] values = state.popValues(count);
		Locale locale = state.getSettings().getLocale();
		StringBuilder line = new StringBuilder();
		int v = 0;
		for (int format : formats) {
			Value item = values[v++];
			int width = format >= 1 ? Operators.toIndex(values[v++]) : 0;
			String text;
			if (format == 2) {
				int decimals = Math.max(0, Operators.toIndex(values[v++]));
				if (!item.isNumber()) {
					throw new TwRuntimeException(
							RuntimeErrorKind.TYPE_MISMATCH,
							"Cannot format " + item.describe() + " with decimals");
				}
				text = String.format(locale, "%." + decimals + "f", item.asNumber());
			} else {
				text = item.format();
			}
			for (int pad = text.length(); pad < width; pad++) {
				line.append(' ');
			}
			line.append(text);
		}
		state.appendOutput(line.toString());
		if (lineEnd) {
			state.flushOutput(true);
		}
	}

	@Override
	public void provideInput(ExecutionState executionState, String text) {
		PascalExecutionState state = (PascalExecutionState) executionState;
		Reference target = state.getPendingRead();
		if (target != null) {
			Value value = convert(text, target.getType());
			if (value == null) {
				state.repeatInputRequest();
				return;
			}
			target.set(value);
		}
		state.setPendingRead(null);
	}

	/**
	 * @return the typed value of an input line, or {@code null} when it does
	 *         not fit the type
	 */
	private static Value convert(String text, PascalType type) {
		String trimmed = text.trim();
		switch (type.getKind()) {
		case INTEGER: {
			Double number = Operators.parseNumber(trimmed);
			if (number == null || !Value.isIntegral(number.doubleValue())) {
				return null;
			}
			return Value.number(number.doubleValue());
		}
		case REAL: {
			Double number = Operators.parseNumber(trimmed);
			return number == null ? null : Value.number(number.doubleValue());
		}
		case CHAR:
			return text.isEmpty() ? null : Value.text(text.substring(0, 1));
		case BOOLEAN:
			if ("true".equalsIgnoreCase(trimmed)) {
				return Value.TRUE;
			} else if ("false".equalsIgnoreCase(trimmed)) {
				return Value.FALSE;
			}
			return null;
		case ARRAY:
			return null;
		default:
			return Value.text(text);
		}
	}
}
