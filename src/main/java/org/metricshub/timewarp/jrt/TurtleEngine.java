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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure turtle state machine: applying a command to a state yields the next
 * state and the draw primitives, in order. Nothing here clamps or wraps
 * coordinates; bounds are the host's business.
 */
public final class TurtleEngine {

	private TurtleEngine() {}

	/**
	 * Result of one command: the next state and what to draw.
	 */
	public static final class TurtleResult {

		private final TurtleState state;
		private final List<DrawPrimitive> primitives;

		TurtleResult(TurtleState state, List<DrawPrimitive> primitives) {
			this.state = state;
			this.primitives = Collections.unmodifiableList(primitives);
		}

		public TurtleState getState() {
			return state;
		}

		public List<DrawPrimitive> getPrimitives() {
			return primitives;
		}
	}

	/**
	 * Applies {@code command} to {@code state}.
	 *
	 * @param state current turtle
	 * @param command command with evaluated arguments
	 * @return next state and emitted primitives
	 */
	public static TurtleResult apply(TurtleState state, TurtleCommand command) {
		List<DrawPrimitive> out = new ArrayList<DrawPrimitive>(1);
		TurtleState next;
		switch (command.getOp()) {
		case FORWARD:
			next = move(state, command.getFirst(), out);
			break;
		case BACK:
			next = move(state, -command.getFirst(), out);
			break;
		case RIGHT:
			next = state.withHeading(normalize(state.getHeading() + command.getFirst()));
			break;
		case LEFT:
			next = state.withHeading(normalize(state.getHeading() - command.getFirst()));
			break;
		case SETHEADING:
			next = state.withHeading(normalize(command.getFirst()));
			break;
		case PENUP:
			next = state.withPen(false);
			break;
		case PENDOWN:
			next = state.withPen(true);
			break;
		case HOME:
			next = moveTo(state, 0d, 0d, out).withHeading(0d);
			break;
		case SETXY:
			next = moveTo(state, command.getFirst(), command.getSecond(), out);
			break;
		case SETCOLOR:
			next = state.withColor(command.getColor());
			break;
		case SETPENSIZE:
			next = state.withPenSize(command.getFirst());
			break;
		case CIRCLE:
			if (state.isPenDown()) {
				out.add(DrawPrimitive.circle(state.getX(), state.getY(), Math.abs(command.getFirst()),
						state.getPenColor(), state.getPenSize()));
			}
			next = state;
			break;
		case CLEARSCREEN:
			out.add(DrawPrimitive.clear());
			next = state.withPosition(0d, 0d).withHeading(0d);
			break;
		case HIDETURTLE:
			next = state.withVisible(false);
			break;
		case SHOWTURTLE:
			next = state.withVisible(true);
			break;
		default:
			throw new IllegalArgumentException("Unknown turtle command " + command);
		}
		return new TurtleResult(next, out);
	}

	private static TurtleState move(TurtleState state, double distance, List<DrawPrimitive> out) {
		double radians = Math.toRadians(state.getHeading());
		double x = state.getX() + distance * Math.sin(radians);
		double y = state.getY() + distance * Math.cos(radians);
		return moveTo(state, x, y, out);
	}

	private static TurtleState moveTo(TurtleState state, double x, double y, List<DrawPrimitive> out) {
		if (state.isPenDown()) {
			out.add(DrawPrimitive.line(state.getX(), state.getY(), x, y, state.getPenColor(), state.getPenSize()));
		}
		return state.withPosition(x, y);
	}

	/**
	 * Brings a heading into [0, 360).
	 *
	 * @param degrees any angle
	 * @return the equivalent heading
	 */
	static double normalize(double degrees) {
		double h = degrees % 360d;
		if (h < 0d) {
			h += 360d;
		}
		return h == 360d ? 0d : h;
	}
}
