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
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.frontend.basic.BasicProgram;
import org.metricshub.timewarp.intermediate.Tuple;
import org.metricshub.timewarp.jrt.Operators;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Runs compiled TW BASIC programs, PILOT and Logo commands included.
 * <p>
 * Variables are global. A name ending with {@code $} holds text; any other
 * name holds a number or a boolean. Arrays live in their own name space and
 * are created with 11 elements on first use when no {@code DIM} ran.
 */
public class BasicInterpreter extends TupleInterpreter {

	private static final int DEFAULT_ARRAY_SIZE = 11;

	private static final Pattern INTERPOLATION = Pattern.compile("([#$])([A-Za-z_][A-Za-z0-9_]*)");

	@Override
	public ExecutionState start(Program program, TwSettings settings) {
		return new BasicExecutionState((BasicProgram) program, settings);
	}

	@Override
	protected void executeTuple(TupleExecutionState executionState, Tuple tuple) {
		BasicExecutionState state = (BasicExecutionState) executionState;
		switch (tuple.getOpcode()) {
		case LOAD_VAR: {
			String name = tuple.getString(0);
			Value value = state.getVariable(name);
			if (value == null) {
				throw new TwRuntimeException(RuntimeErrorKind.UNDEFINED_VARIABLE, "Undefined variable " + name);
			}
			state.push(value);
			break;
		}
		case STORE_VAR: {
			String name = tuple.getString(0);
			Value value = state.popValue();
			checkAssignable(name, value);
			state.setVariable(name, value);
			break;
		}
		case LOAD_ELEMENT: {
			// stack[0] = index
			int index = Operators.toIndex(state.popValue());
			state.push(array(state, tuple.getString(0)).get(index));
			break;
		}
		case STORE_ELEMENT: {
			// stack[0] = value
			// stack[1] = index
			String name = tuple.getString(0);
			Value value = state.popValue();
			int index = Operators.toIndex(state.popValue());
			checkAssignable(name, value);
			state.setArray(name, array(state, name).with(index, value));
			break;
		}
		case DIM: {
			String name = tuple.getString(0);
			int upper = Operators.toIndex(state.popValue());
			if (upper < 0) {
				throw new TwRuntimeException(RuntimeErrorKind.INDEX_OUT_OF_RANGE, "Negative size for array " + name);
			}
			state.setArray(name, Value.filledList(upper + 1, initialValue(name)));
			break;
		}
		case PRINT:
			print(state, tuple.getString(0), tuple.getBoolean(1));
			break;
		case INPUT:
			state.awaitInput(tuple.getString(0), false);
			state.setColumn(0);
			state.requestInput(tuple.getString(1));
			break;
		case GOTO_LINE:
			state.jump(lineAddress(state, state.popValue()));
			break;
		case GOSUB_LINE: {
			int target = lineAddress(state, state.popValue());
			state.getReturnStack().push(state.getPosition());
			state.jump(target);
			break;
		}
		case GOTO_LABEL:
			state.jump(labelAddress(state, tuple.getString(0)));
			break;
		case GOSUB_LABEL: {
			int target = labelAddress(state, tuple.getString(0));
			state.getReturnStack().push(state.getPosition());
			state.jump(target);
			break;
		}
		case RETURN:
			if (state.getReturnStack().isEmpty()) {
				throw new TwRuntimeException(RuntimeErrorKind.RETURN_WITHOUT_GOSUB, "RETURN without GOSUB");
			}
			state.jump(state.getReturnStack().pop());
			break;
		case FOR_INIT:
			forInit(state, tuple);
			break;
		case FOR_NEXT:
			forNext(state, tuple.getString(0));
			break;
		case REPEAT_INIT: {
			long count = Operators.toLong(state.popValue());
			if (count <= 0) {
				state.jump(tuple.getAddress().index());
			} else {
				state.getRepeatCounters().push(count);
			}
			break;
		}
		case REPEAT_NEXT:
			if (!state.getRepeatCounters().isEmpty()) {
				long remaining = state.getRepeatCounters().pop() - 1;
				if (remaining > 0) {
					state.getRepeatCounters().push(remaining);
					state.jump(tuple.getAddress().index());
				}
			}
			break;
		case TYPE: {
			String text = interpolate(state, tuple.getString(0));
			if (tuple.getBoolean(1)) {
				state.setPendingPrompt(text);
			} else {
				state.getChannel().output(text, true);
				state.setColumn(0);
			}
			break;
		}
		case ACCEPT:
			state.awaitInput(tuple.getString(0), true);
			state.setColumn(0);
			state.requestInput(state.takePendingPrompt());
			break;
		case MATCH:
			state.setMatched(matches(state.getAnswer(), tuple.getString(0)));
			break;
		case PUSH_MATCH:
			state.push(Value.bool(state.isMatched()));
			break;
		case PILOT_END:
			if (state.getReturnStack().isEmpty()) {
				state.complete(ExecutionEvent.CompletionReason.HALTED);
			} else {
				state.jump(state.getReturnStack().pop());
			}
			break;
		default:
			throw new IllegalStateException("Unexpected instruction in a BASIC program: " + tuple);
		}
	}

	@Override
	public void provideInput(ExecutionState executionState, String text) {
		BasicExecutionState state = (BasicExecutionState) executionState;
		String name = state.getInputVariable();
		if (state.isInputAnswer()) {
			state.setAnswer(text);
		}
		if (name != null) {
			if (BasicProgram.isTextVariable(name)) {
				state.setVariable(name, Value.text(text));
			} else {
				Double number = Operators.parseNumber(text);
				if (number == null) {
					state.repeatInputRequest();
					return;
				}
				state.setVariable(name, Value.number(number.doubleValue()));
			}
		}
		state.awaitInput(null, false);
	}

	private static void checkAssignable(String name, Value value) {
		boolean textVariable = BasicProgram.isTextVariable(name);
		if (value.isList() || textVariable != value.isText()) {
			throw new TwRuntimeException(
					RuntimeErrorKind.TYPE_MISMATCH,
					"Cannot assign " + value.describe() + " to " + (textVariable ? "text" : "numeric") + " variable "
							+ name);
		}
	}

	private static Value initialValue(String name) {
		return BasicProgram.isTextVariable(name) ? Value.EMPTY_TEXT : Value.ZERO;
	}

	private static Value array(BasicExecutionState state, String name) {
		Value array = state.getArray(name);
		if (array == null) {
			array = Value.filledList(DEFAULT_ARRAY_SIZE, initialValue(name));
			state.setArray(name, array);
		}
		return array;
	}

	/**
	 * Prints the items as one event. A {@code ,} after an item pads to the
	 * next print zone, counted from the start of the output line.
	 */
	private static void print(BasicExecutionState state, String separators, boolean lineEnd) {
		Value[] items = state.popValues(separators.length());
		int zone = state.getSettings().getPrintZoneWidth();
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < items.length; i++) {
			sb.append(items[i].format());
			if (separators.charAt(i) == ',') {
				int column = state.getColumn() + sb.length();
				int pad = zone - column % zone;
				for (int j = 0; j < pad; j++) {
					sb.append(' ');
				}
			}
		}
		state.getChannel().output(sb.toString(), lineEnd);
		state.setColumn(lineEnd ? 0 : state.getColumn() + sb.length());
	}

	private static int lineAddress(BasicExecutionState state, Value target) {
		double number = target.asNumber();
		Integer address = Value.isIntegral(number) ? state.getBasicProgram().getLineAddress((long) number) : null;
		if (address == null) {
			throw new TwRuntimeException(
					RuntimeErrorKind.UNDEFINED_LINE,
					"Undefined line number " + Value.formatNumber(number));
		}
		return address;
	}

	private static int labelAddress(BasicExecutionState state, String label) {
		Integer address = state.getBasicProgram().getLabelAddress(label);
		if (address == null) {
			throw new TwRuntimeException(RuntimeErrorKind.UNDEFINED_LINE, "Undefined label *" + label);
		}
		return address;
	}

	private static void forInit(BasicExecutionState state, Tuple tuple) {
		// stack[0] = step
		// stack[1] = limit
		// stack[2] = start
		String name = tuple.getString(0);
		double step = state.popValue().asNumber();
		double limit = state.popValue().asNumber();
		double start = state.popValue().asNumber();
		List<BasicExecutionState.ForLoop> loops = state.getForLoops();
		for (int i = loops.size() - 1; i >= 0; i--) {
			if (loops.get(i).variable.equals(name)) {
				loops.subList(i, loops.size()).clear();
				break;
			}
		}
		state.setVariable(name, Value.number(start));
		BasicExecutionState.ForLoop loop = new BasicExecutionState.ForLoop(name, limit, step, state.getPosition());
		if (loop.isDone(start)) {
			state.jump(tuple.getAddress().index());
		} else {
			loops.add(loop);
		}
	}

	private static void forNext(BasicExecutionState state, String name) {
		List<BasicExecutionState.ForLoop> loops = state.getForLoops();
		int index = loops.size() - 1;
		if (name != null) {
			while (index >= 0 && !loops.get(index).variable.equals(name)) {
				index--;
			}
		}
		if (index < 0) {
			throw new TwRuntimeException(
					RuntimeErrorKind.NEXT_WITHOUT_FOR,
					name == null ? "NEXT without FOR" : "NEXT " + name + " without FOR");
		}
		loops.subList(index + 1, loops.size()).clear();
		BasicExecutionState.ForLoop loop = loops.get(index);
		Value current = state.getVariable(loop.variable);
		double value = (current == null ? 0d : current.asNumber()) + loop.step;
		state.setVariable(loop.variable, Value.number(value));
		if (loop.isDone(value)) {
			loops.remove(index);
		} else {
			state.jump(loop.body);
		}
	}

	/**
	 * Replaces {@code #NAME} with the numeric variable {@code NAME} and
	 * {@code $NAME} with the text variable {@code NAME$}.
	 */
	private static String interpolate(BasicExecutionState state, String template) {
		Matcher matcher = INTERPOLATION.matcher(template);
		StringBuffer sb = new StringBuffer();
		while (matcher.find()) {
			String name = matcher.group(2).toUpperCase(Locale.ROOT);
			if ("$".equals(matcher.group(1))) {
				name = name + "$";
			}
			Value value = state.getVariable(name);
			if (value == null) {
				throw new TwRuntimeException(RuntimeErrorKind.UNDEFINED_VARIABLE, "Undefined variable " + name);
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(value.format()));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	/**
	 * PILOT {@code M:}: the answer matches when it contains one of the
	 * comma-separated words, ignoring case.
	 */
	static boolean matches(String answer, String words) {
		String normalized = answer.trim().toUpperCase(Locale.ROOT);
		for (String word : words.split(",")) {
			String w = word.trim().toUpperCase(Locale.ROOT);
			if (!w.isEmpty() && normalized.contains(w)) {
				return true;
			}
		}
		return false;
	}
}
