package org.metricshub.timewarp.intermediate;

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

/**
 * Instructions of the stack machine shared by the BASIC and Pascal back ends.
 * <p>
 * Unless noted otherwise, an instruction pops its operands from the operand
 * stack (the right-hand operand on top) and pushes its result.
 */
public enum Opcode {
	/**
	 * A no-operation. The operand stack contents are
	 * unaffected.
	 */
	NOP,
	/**
	 * Pops an item off the operand stack.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	POP,
	/**
	 * Pushes a constant onto the operand stack.
	 * <p>
	 * Argument: the {@code Value}
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: x ...
	 */
	PUSH,
	/**
	 * Jumps to a specified address. The operand stack contents
	 * are unaffected.
	 */
	GOTO,
	/**
	 * Pops and evaluates the top-of-stack; if
	 * false, it jumps to a specified address.
	 * <p>
	 * Argument: address
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	IFFALSE,
	/**
	 * Pops and evaluates the top-of-stack; if
	 * true, it jumps to a specified address.
	 * <p>
	 * Argument: address
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	IFTRUE,
	/**
	 * Stack before: x ...<br/>
	 * Stack after: -x ...
	 */
	NEGATE,
	/**
	 * Stack before: x ...<br/>
	 * Stack after: !x ...
	 */
	NOT,
	/**
	 * Adds two numbers, or concatenates two texts.
	 * <p>
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1+x2 ...
	 */
	ADD,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1-x2 ...
	 */
	SUBTRACT,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1*x2 ...
	 */
	MULTIPLY,
	/**
	 * Real division.
	 * <p>
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1/x2 ...
	 */
	DIVIDE,
	/**
	 * Truncating integer division ({@code div}).
	 * <p>
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1 div x2 ...
	 */
	INT_DIVIDE,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1%x2 ...
	 */
	MODULO,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1^x2 ...
	 */
	POWER,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: (x1 and x2) ...
	 */
	AND,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: (x1 or x2) ...
	 */
	OR,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1==x2 ...
	 */
	CMP_EQ,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1!=x2 ...
	 */
	CMP_NE,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1&lt;x2 ...
	 */
	CMP_LT,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1&lt;=x2 ...
	 */
	CMP_LE,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1&gt;x2 ...
	 */
	CMP_GT,
	/**
	 * Stack before: x2 x1 ...<br/>
	 * Stack after: x1&gt;=x2 ...
	 */
	CMP_GE,
	/**
	 * Calls a built-in function with N arguments.
	 * <p>
	 * Argument 1: the {@code Builtin}<br/>
	 * Argument 2: # of arguments (N)
	 * <p>
	 * Stack before: xN .. x2 x1 ...<br/>
	 * Stack after: result ...
	 */
	CALL_BUILTIN,
	/**
	 * Moves the turtle. The number of operands is the arity of the command.
	 * <p>
	 * Argument: the {@code TurtleCommand.Op}
	 * <p>
	 * Stack before: xN .. x1 ...<br/>
	 * Stack after: ...
	 */
	TURTLE,
	/**
	 * Emits a {@code CLEAR} draw primitive without moving the turtle.
	 */
	CLEAR_SCREEN,
	/**
	 * Stops the program. The run completes with reason {@code HALTED}.
	 */
	HALT,

	// BASIC

	/**
	 * Pushes the value of a BASIC variable.
	 * <p>
	 * Argument: variable name
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: x ...
	 */
	LOAD_VAR,
	/**
	 * Assigns a BASIC variable.
	 * <p>
	 * Argument: variable name
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	STORE_VAR,
	/**
	 * Pushes an element of a BASIC array.
	 * <p>
	 * Argument: array name
	 * <p>
	 * Stack before: index ...<br/>
	 * Stack after: x ...
	 */
	LOAD_ELEMENT,
	/**
	 * Assigns an element of a BASIC array.
	 * <p>
	 * Argument: array name
	 * <p>
	 * Stack before: x index ...<br/>
	 * Stack after: ...
	 */
	STORE_ELEMENT,
	/**
	 * Allocates a BASIC array of N+1 elements.
	 * <p>
	 * Argument: array name
	 * <p>
	 * Stack before: N ...<br/>
	 * Stack after: ...
	 */
	DIM,
	/**
	 * Prints N items as one output event.
	 * <p>
	 * Argument 1: separator following each item ({@code ';'}, {@code ','} or {@code ' '})<br/>
	 * Argument 2: true when a line break follows
	 * <p>
	 * Stack before: xN .. x2 x1 ...<br/>
	 * Stack after: ...
	 */
	PRINT,
	/**
	 * Suspends until the host supplies a value for a variable.
	 * <p>
	 * Argument 1: variable name<br/>
	 * Argument 2: prompt, may be {@code null}
	 */
	INPUT,
	/**
	 * Jumps to a BASIC line number.
	 * <p>
	 * Stack before: line ...<br/>
	 * Stack after: ...
	 */
	GOTO_LINE,
	/**
	 * Saves the return address and jumps to a BASIC line number.
	 * <p>
	 * Stack before: line ...<br/>
	 * Stack after: ...
	 */
	GOSUB_LINE,
	/**
	 * Jumps to a {@code *label}.
	 * <p>
	 * Argument: label name
	 */
	GOTO_LABEL,
	/**
	 * Saves the return address and jumps to a {@code *label}.
	 * <p>
	 * Argument: label name
	 */
	GOSUB_LABEL,
	/**
	 * Returns to the address saved by the latest {@code GOSUB}.
	 */
	RETURN,
	/**
	 * Starts a {@code FOR} loop, or skips it when the start value is
	 * already past the limit.
	 * <p>
	 * Argument 1: control variable name<br/>
	 * Argument 2: address following the matching {@code NEXT}
	 * <p>
	 * Stack before: step limit start ...<br/>
	 * Stack after: ...
	 */
	FOR_INIT,
	/**
	 * Advances the innermost (or the named) {@code FOR} loop.
	 * <p>
	 * Argument: control variable name, may be {@code null}
	 */
	FOR_NEXT,
	/**
	 * Starts a {@code REPEAT} block, or skips it when the count is not positive.
	 * <p>
	 * Argument: address following the block
	 * <p>
	 * Stack before: count ...<br/>
	 * Stack after: ...
	 */
	REPEAT_INIT,
	/**
	 * Counts one iteration of the innermost {@code REPEAT} block and jumps
	 * back to its body while iterations remain.
	 * <p>
	 * Argument: address of the block body
	 */
	REPEAT_NEXT,
	/**
	 * PILOT {@code T:}: types interpolated text.
	 * <p>
	 * Argument 1: text template<br/>
	 * Argument 2: true when the text is kept as the prompt of the next {@code A:}
	 */
	TYPE,
	/**
	 * PILOT {@code A:}: suspends for an answer.
	 * <p>
	 * Argument: variable name, may be {@code null}
	 */
	ACCEPT,
	/**
	 * PILOT {@code M:}: matches the last answer against a list of words.
	 * <p>
	 * Argument: the words
	 */
	MATCH,
	/**
	 * Pushes the result of the last PILOT match.
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: flag ...
	 */
	PUSH_MATCH,
	/**
	 * PILOT {@code E:}: returns from a {@code U:} call, or ends the program.
	 */
	PILOT_END,

	// Pascal

	/**
	 * Pushes the value of a Pascal variable.
	 * <p>
	 * Argument 1: slot<br/>
	 * Argument 2: true for a global slot
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: x ...
	 */
	LOAD_SLOT,
	/**
	 * Assigns a Pascal variable, converting to its declared type.
	 * <p>
	 * Argument 1: slot<br/>
	 * Argument 2: true for a global slot
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	STORE_SLOT,
	/**
	 * Pushes an array element (or a character of a string).
	 * <p>
	 * Argument 1: slot<br/>
	 * Argument 2: true for a global slot
	 * <p>
	 * Stack before: index ...<br/>
	 * Stack after: x ...
	 */
	LOAD_INDEXED,
	/**
	 * Assigns an array element.
	 * <p>
	 * Argument 1: slot<br/>
	 * Argument 2: true for a global slot
	 * <p>
	 * Stack before: x index ...<br/>
	 * Stack after: ...
	 */
	STORE_INDEXED,
	/**
	 * Pushes a reference to a variable, for a {@code var} parameter or {@code readln}.
	 * <p>
	 * Argument 1: slot<br/>
	 * Argument 2: true for a global slot
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: ref ...
	 */
	PUSH_REF,
	/**
	 * Pushes a reference to an array element.
	 * <p>
	 * Argument 1: slot<br/>
	 * Argument 2: true for a global slot
	 * <p>
	 * Stack before: index ...<br/>
	 * Stack after: ref ...
	 */
	PUSH_ELEMENT_REF,
	/**
	 * Calls a procedure or function. The arguments become the first slots
	 * of the new activation record.
	 * <p>
	 * Argument: routine index
	 * <p>
	 * Stack before: xN .. x1 ...<br/>
	 * Stack after: ... (result ... for a function, once it returns)
	 */
	CALL,
	/**
	 * Leaves the current routine, pushing the result of a function.
	 */
	RETURN_ROUTINE,
	/**
	 * Assigns the result of the current function.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	STORE_RESULT,
	/**
	 * Writes N items to the current output line.
	 * <p>
	 * Argument 1: for each item, the number of format operands (0, 1 or 2)<br/>
	 * Argument 2: true for {@code writeln}
	 * <p>
	 * Stack before: [decimals] [width] xN .. x1 ...<br/>
	 * Stack after: ...
	 */
	WRITE,
	/**
	 * Suspends until the host supplies a value for a referenced variable.
	 * Without a reference, the input line is read and ignored.
	 * <p>
	 * Argument: true when a reference is on the stack
	 * <p>
	 * Stack before: ref ...<br/>
	 * Stack after: ...
	 */
	READ
}
