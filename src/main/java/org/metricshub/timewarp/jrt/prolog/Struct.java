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

import java.util.List;
import java.util.Map;

/**
 * A compound term {@code name(arg1, ..., argN)}. Lists are built from
 * {@code '.'/2} cells ending with {@link Atom#NIL}.
 */
public final class Struct extends Term {

	private static final long serialVersionUID = 1L;

	public static final String LIST_FUNCTOR = ".";

	private final String name;
	private final Term[] args;

	public Struct(String name, Term... args) {
		if (args.length == 0) {
			throw new IllegalArgumentException("A compound term needs arguments: " + name);
		}
		this.name = name;
		this.args = args;
	}

	public static Struct cons(Term head, Term tail) {
		return new Struct(LIST_FUNCTOR, head, tail);
	}

	/**
	 * @param elements list elements
	 * @param tail what follows the last element, usually {@link Atom#NIL}
	 * @return the list term
	 */
	public static Term list(List<? extends Term> elements, Term tail) {
		Term result = tail;
		for (int i = elements.size() - 1; i >= 0; i--) {
			result = cons(elements.get(i), result);
		}
		return result;
	}

	public String getName() {
		return name;
	}

	public int getArity() {
		return args.length;
	}

	public Term getArg(int index) {
		return args[index];
	}

	/**
	 * @return {@code name/arity}
	 */
	public String getKey() {
		return name + "/" + args.length;
	}

	public boolean isListCell() {
		return args.length == 2 && LIST_FUNCTOR.equals(name);
	}

	@Override
	public Term copy(Map<Variable, Variable> renaming) {
		Term[] copies = new Term[args.length];
		for (int i = 0; i < args.length; i++) {
			copies[i] = args[i].copy(renaming);
		}
		return new Struct(name, copies);
	}

	@Override
	public Term resolve() {
		Term[] resolved = new Term[args.length];
		for (int i = 0; i < args.length; i++) {
			resolved[i] = args[i].resolve();
		}
		return new Struct(name, resolved);
	}

	@Override
	public boolean identical(Term other) {
		Term o = other.deref();
		if (!(o instanceof Struct)) {
			return false;
		}
		Struct s = (Struct) o;
		if (!s.name.equals(name) || s.args.length != args.length) {
			return false;
		}
		for (int i = 0; i < args.length; i++) {
			if (!args[i].identical(s.args[i])) {
				return false;
			}
		}
		return true;
	}
}
