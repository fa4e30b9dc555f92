package org.metricshub.timewarp.jrt.prolog;

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

import java.util.HashMap;
import java.util.Map;

/**
 * The fixed operator table, shared by the reader and {@link TermWriter}.
 */
public final class PrologOperators {

	/** Operator type in the usual {@code xfx} notation. */
	public enum Type {
		XFX,
		XFY,
		YFX,
		FY,
		FX;

		public boolean isPrefix() {
			return this == FY || this == FX;
		}
	}

	/** One operator definition. */
	public static final class Definition {
		private final String name;
		private final int priority;
		private final Type type;

		Definition(String name, int priority, Type type) {
			this.name = name;
			this.priority = priority;
			this.type = type;
		}

		public String getName() {
			return name;
		}

		public int getPriority() {
			return priority;
		}

		public Type getType() {
			return type;
		}

		/**
		 * @return the highest priority allowed for the left argument
		 */
		public int leftMax() {
			return type == Type.YFX ? priority : priority - 1;
		}

		/**
		 * @return the highest priority allowed for the right (or only) argument
		 */
		public int rightMax() {
			return type == Type.XFY || type == Type.FY ? priority : priority - 1;
		}
	}

	private static final Map<String, Definition> INFIX = new HashMap<String, Definition>();
	private static final Map<String, Definition> PREFIX = new HashMap<String, Definition>();

	static {
		infix(1200, Type.XFX, ":-");
		prefix(1200, Type.FX, ":-", "?-");
		infix(1100, Type.XFY, ";");
		infix(1050, Type.XFY, "->");
		infix(1000, Type.XFY, ",");
		prefix(900, Type.FY, "\\+");
		infix(700, Type.XFX, "=", "\\=", "==", "\\==", "is", "=:=", "=\\=", "<", ">", "=<", ">=");
		infix(500, Type.YFX, "+", "-");
		infix(400, Type.YFX, "*", "/", "//", "mod");
		infix(200, Type.XFX, "**");
		prefix(200, Type.FY, "-", "+");
	}

	private PrologOperators() {}

	private static void infix(int priority, Type type, String... names) {
		for (String name : names) {
			INFIX.put(name, new Definition(name, priority, type));
		}
	}

	private static void prefix(int priority, Type type, String... names) {
		for (String name : names) {
			PREFIX.put(name, new Definition(name, priority, type));
		}
	}

	/**
	 * @return the infix definition of {@code name}, or {@code null}
	 */
	public static Definition infix(String name) {
		return INFIX.get(name);
	}

	/**
	 * @return the prefix definition of {@code name}, or {@code null}
	 */
	public static Definition prefix(String name) {
		return PREFIX.get(name);
	}
}
