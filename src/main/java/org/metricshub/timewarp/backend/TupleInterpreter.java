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

import java.util.Locale;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.intermediate.Builtin;
import org.metricshub.timewarp.intermediate.Tuple;
import org.metricshub.timewarp.intermediate.TupleProgram;
import org.metricshub.timewarp.jrt.DrawPrimitive;
import org.metricshub.timewarp.jrt.IOChannel;
import org.metricshub.timewarp.jrt.Operators;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TurtleCommand;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;

/**
 * Stack machine over {@link TupleProgram}s, shared by the BASIC and Pascal
 * interpreters.
 * <p>
 * The loop handles the expression, jump, built-in function and turtle
 * instructions itself and hands everything else to
 * {@link #executeTuple(TupleExecutionState, Tuple)}. It returns to the
 * caller as soon as the channel holds an event, so a long loop that prints
 * gives the host control after every line.
 * <p>
 * Runtime errors raised while executing an instruction are reported with the
 * instruction's source line.
 */
public abstract class TupleInterpreter implements Interpreter {

	/** Colors of the numbered palette used by {@code SETCOLOR n}. */
	private static final String[] PALETTE = {
			"black",
			"blue",
			"green",
			"cyan",
			"red",
			"magenta",
			"yellow",
			"white",
			"gray",
			"orange",
			"purple",
			"brown" };

	@Override
	public void execute(ExecutionState executionState) {
		TupleExecutionState state = (TupleExecutionState) executionState;
		TupleProgram tuples = state.getTuples();
		IOChannel channel = state.getChannel();

		while (!channel.hasEvents() && !channel.isAwaitingInput() && !state.isTerminated()) {
			if (state.isAborted()) {
				return;
			}
			if (state.getPosition() >= tuples.size()) {
				state.complete(ExecutionEvent.CompletionReason.END_OF_PROGRAM);
				return;
			}
			Tuple tuple = tuples.get(state.getPosition());
			try {
				state.countInstruction();
				state.next();
				interpret(state, tuple);
			} catch (TwRuntimeException e) {
				throw e.atLine(tuple.getLineNumber());
			}
		}
	}

	private void interpret(TupleExecutionState state, Tuple tuple) {
		switch (tuple.getOpcode()) {
		case NOP:
			break;
		case POP:
			state.pop();
			break;
		case PUSH:
			state.push(tuple.getValue(0));
			break;
		case GOTO:
			state.jump(tuple.getAddress().index());
			break;
		case IFFALSE:
			if (!state.popValue().isTrue()) {
				state.jump(tuple.getAddress().index());
			}
			break;
		case IFTRUE:
			if (state.popValue().isTrue()) {
				state.jump(tuple.getAddress().index());
			}
			break;
		case NEGATE:
			state.push(Operators.negate(state.popValue()));
			break;
		case NOT:
			state.push(Operators.not(state.popValue()));
			break;
		case ADD:
		case SUBTRACT:
		case MULTIPLY:
		case DIVIDE:
		case INT_DIVIDE:
		case MODULO:
		case POWER:
		case AND:
		case OR:
		case CMP_EQ:
		case CMP_NE:
		case CMP_LT:
		case CMP_LE:
		case CMP_GT:
		case CMP_GE: {
			// stack[0] = item2
			// stack[1] = item1
			Value o2 = state.popValue();
			Value o1 = state.popValue();
			state.push(binary(tuple, o1, o2));
			break;
		}
		case CALL_BUILTIN: {
			Builtin builtin = (Builtin) tuple.getArg(0);
			Value[] args = state.popValues(tuple.getInt(1));
			state.push(builtin.apply(args, state.getRandom()));
			break;
		}
		case TURTLE:
			turtle(state, (TurtleCommand.Op) tuple.getArg(0));
			break;
		case CLEAR_SCREEN:
			state.getChannel().draw(DrawPrimitive.clear());
			break;
		case HALT:
			state.complete(ExecutionEvent.CompletionReason.HALTED);
			break;
		default:
			executeTuple(state, tuple);
		}
	}

	private static Value binary(Tuple tuple, Value o1, Value o2) {
		switch (tuple.getOpcode()) {
		case ADD:
			return Operators.add(o1, o2);
		case SUBTRACT:
			return Operators.subtract(o1, o2);
		case MULTIPLY:
			return Operators.multiply(o1, o2);
		case DIVIDE:
			return Operators.divide(o1, o2);
		case INT_DIVIDE:
			return Operators.intDivide(o1, o2);
		case MODULO:
			return Operators.modulo(o1, o2);
		case POWER:
			return Operators.power(o1, o2);
		case AND:
			return Operators.and(o1, o2);
		case OR:
			return Operators.or(o1, o2);
		case CMP_EQ:
			return Value.bool(Operators.equal(o1, o2));
		case CMP_NE:
			return Value.bool(!Operators.equal(o1, o2));
		case CMP_LT:
			return Value.bool(Operators.compare(o1, o2) < 0);
		case CMP_LE:
			return Value.bool(Operators.compare(o1, o2) <= 0);
		case CMP_GT:
			return Value.bool(Operators.compare(o1, o2) > 0);
		case CMP_GE:
			return Value.bool(Operators.compare(o1, o2) >= 0);
		default:
			throw new IllegalStateException("Not a binary operator: " + tuple);
		}
	}

	private static void turtle(TupleExecutionState state, TurtleCommand.Op op) {
		Value[] args = state.popValues(op.arity());
		TurtleCommand command;
		switch (op.arity()) {
		case 0:
			command = TurtleCommand.of(op);
			break;
		case 2:
			command = TurtleCommand.of(op, args[0].asNumber(), args[1].asNumber());
			break;
		default:
			if (op == TurtleCommand.Op.SETCOLOR) {
				command = TurtleCommand.color(colorName(args[0]));
			} else {
				command = TurtleCommand.of(op, args[0].asNumber());
			}
		}
		state.applyTurtle(command);
	}

	/**
	 * A color is either a name or an index in the numbered palette.
	 */
	static String colorName(Value value) {
		if (value.isText()) {
			return value.asText().trim().toLowerCase(Locale.ROOT);
		}
		int index = Operators.toIndex(value);
		if (index < 0 || index >= PALETTE.length) {
			throw new TwRuntimeException(
					RuntimeErrorKind.ILLEGAL_ARGUMENT,
					"Color number " + index + " out of range 0.." + (PALETTE.length - 1));
		}
		return PALETTE[index];
	}

	/**
	 * Executes an instruction specific to the language.
	 *
	 * @param state the run, positioned after the instruction
	 * @param tuple the instruction
	 */
	protected abstract void executeTuple(TupleExecutionState state, Tuple tuple);
}
