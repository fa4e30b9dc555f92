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
 * Immutable snapshot of the turtle: logical position, heading, pen and
 * visibility. Heading 0 faces up and grows clockwise; y grows upward.
 */
public final class TurtleState implements Serializable {

	private static final long serialVersionUID = 1L;

	public static final String DEFAULT_COLOR = "black";

	/** Canonical start state: origin, facing up, pen down, visible. */
	public static final TurtleState HOME = new TurtleState(0d, 0d, 0d, true, DEFAULT_COLOR, 1d, true);

	private final double x;
	private final double y;
	private final double heading;
	private final boolean penDown;
	private final String penColor;
	private final double penSize;
	private final boolean visible;

	public TurtleState(double x, double y, double heading, boolean penDown, String penColor, double penSize,
			boolean visible) {
		this.x = x;
		this.y = y;
		this.heading = heading;
		this.penDown = penDown;
		this.penColor = penColor;
		this.penSize = penSize;
		this.visible = visible;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public double getHeading() {
		return heading;
	}

	public boolean isPenDown() {
		return penDown;
	}

	public String getPenColor() {
		return penColor;
	}

	public double getPenSize() {
		return penSize;
	}

	public boolean isVisible() {
		return visible;
	}

	TurtleState withPosition(double newX, double newY) {
		return new TurtleState(newX, newY, heading, penDown, penColor, penSize, visible);
	}

	TurtleState withHeading(double newHeading) {
		return new TurtleState(x, y, newHeading, penDown, penColor, penSize, visible);
	}

	TurtleState withPen(boolean down) {
		return new TurtleState(x, y, heading, down, penColor, penSize, visible);
	}

	TurtleState withColor(String color) {
		return new TurtleState(x, y, heading, penDown, color, penSize, visible);
	}

	TurtleState withPenSize(double size) {
		return new TurtleState(x, y, heading, penDown, penColor, size, visible);
	}

	TurtleState withVisible(boolean show) {
		return new TurtleState(x, y, heading, penDown, penColor, penSize, show);
	}

	@Override
	public String toString() {
		return "Turtle[x=" + Value.formatNumber(x)
				+ ", y=" + Value.formatNumber(y)
				+ ", heading=" + Value.formatNumber(heading)
				+ ", pen=" + (penDown ? "down" : "up")
				+ ", color=" + penColor + "]";
	}
}
