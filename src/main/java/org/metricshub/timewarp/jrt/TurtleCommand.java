package org.metricshub.timewarp.jrt;

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

import java.io.Serializable;

/**
 * A turtle command with its already-evaluated argument.
 */
public final class TurtleCommand implements Serializable {

	private static final long serialVersionUID = 1L;

	/** The turtle vocabulary, with the number of arguments each takes. */
	public enum Op {
		FORWARD(1),
		BACK(1),
		RIGHT(1),
		LEFT(1),
		PENUP(0),
		PENDOWN(0),
		HOME(0),
		SETXY(2),
		SETHEADING(1),
		SETCOLOR(1),
		SETPENSIZE(1),
		CIRCLE(1),
		CLEARSCREEN(0),
		HIDETURTLE(0),
		SHOWTURTLE(0);

		private final int arity;

		Op(int arity) {
			this.arity = arity;
		}

		public int arity() {
			return arity;
		}
	}

	private final Op op;
	private final double first;
	private final double second;
	private final String color;

	private TurtleCommand(Op op, double first, double second, String color) {
		this.op = op;
		this.first = first;
		this.second = second;
		this.color = color;
	}

	public static TurtleCommand of(Op op) {
		return new TurtleCommand(op, 0d, 0d, null);
	}

	public static TurtleCommand of(Op op, double amount) {
		return new TurtleCommand(op, amount, 0d, null);
	}

	public static TurtleCommand of(Op op, double first, double second) {
		return new TurtleCommand(op, first, second, null);
	}

	public static TurtleCommand color(String color) {
		return new TurtleCommand(Op.SETCOLOR, 0d, 0d, color);
	}

	public Op getOp() {
		return op;
	}

	public double getFirst() {
		return first;
	}

	public double getSecond() {
		return second;
	}

	public String getColor() {
		return color;
	}

	@Override
	public String toString() {
		return op + (color != null ? " " + color : op.arity() > 0 ? " " + Value.formatNumber(first) : "");
	}
}
