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

import java.util.Map;

/**
 * A constant symbol. The empty list is the atom {@code []}.
 */
public final class Atom extends Term {

	private static final long serialVersionUID = 1L;

	public static final Atom NIL = new Atom("[]");
	public static final Atom TRUE = new Atom("true");
	public static final Atom CUT = new Atom("!");

	private final String name;

	public Atom(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public Term copy(Map<Variable, Variable> renaming) {
		return this;
	}

	@Override
	public Term resolve() {
		return this;
	}

	@Override
	public boolean identical(Term other) {
		Term o = other.deref();
		return o instanceof Atom && ((Atom) o).name.equals(name);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Atom && ((Atom) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}
}
