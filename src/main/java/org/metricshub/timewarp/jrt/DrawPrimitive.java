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
import java.util.Locale;

/**
 * One drawing operation produced by the turtle engine, in canvas-independent
 * logical coordinates. The host maps them onto its canvas.
 */
public final class DrawPrimitive implements Serializable {

	private static final long serialVersionUID = 1L;

	/** Kinds of primitives. */
	public enum Kind {
		/** Segment from (x1, y1) to (x2, y2). */
		LINE,
		/** Circle centered on (x1, y1) with radius x2. */
		CIRCLE,
		/** Wipe the canvas. */
		CLEAR
	}

	private final Kind kind;
	private final double x1;
	private final double y1;
	private final double x2;
	private final double y2;
	private final String color;
	private final double width;

	private DrawPrimitive(Kind kind, double x1, double y1, double x2, double y2, String color, double width) {
		this.kind = kind;
		this.x1 = x1;
		this.y1 = y1;
		this.x2 = x2;
		this.y2 = y2;
		this.color = color;
		this.width = width;
	}

	public static DrawPrimitive line(double fromX, double fromY, double toX, double toY, String color, double width) {
		return new DrawPrimitive(Kind.LINE, fromX, fromY, toX, toY, color, width);
	}

	public static DrawPrimitive circle(double centerX, double centerY, double radius, String color, double width) {
		return new DrawPrimitive(Kind.CIRCLE, centerX, centerY, radius, 0d, color, width);
	}

	public static DrawPrimitive clear() {
		return new DrawPrimitive(Kind.CLEAR, 0d, 0d, 0d, 0d, null, 0d);
	}

	public Kind getKind() {
		return kind;
	}

	public double getX1() {
		return x1;
	}

	public double getY1() {
		return y1;
	}

	public double getX2() {
		return x2;
	}

	public double getY2() {
		return y2;
	}

	/**
	 * @return radius of a {@link Kind#CIRCLE}
	 */
	public double getRadius() {
		return x2;
	}

	public String getColor() {
		return color;
	}

	public double getWidth() {
		return width;
	}

	@Override
	public String toString() {
		switch (kind) {
		case LINE:
			return String.format(Locale.US, "LINE %s,%s -> %s,%s %s",
					Value.formatNumber(round(x1)), Value.formatNumber(round(y1)),
					Value.formatNumber(round(x2)), Value.formatNumber(round(y2)), color);
		case CIRCLE:
			return String.format(Locale.US, "CIRCLE %s,%s r=%s %s",
					Value.formatNumber(round(x1)), Value.formatNumber(round(y1)),
					Value.formatNumber(round(x2)), color);
		default:
			return "CLEAR";
		}
	}

	private static double round(double d) {
		return Math.rint(d * 1e6) / 1e6;
	}
}
