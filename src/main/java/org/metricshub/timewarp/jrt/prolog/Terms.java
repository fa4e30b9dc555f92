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

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers on lists and predicate keys.
 */
public final class Terms {

	private Terms() {}

	/**
	 * @param term a callable term
	 * @return {@code name/arity}, or {@code null} when the term is not callable
	 */
	public static String key(Term term) {
		Term t = term.deref();
		if (t instanceof Atom) {
			return ((Atom) t).getName() + "/0";
		}
		if (t instanceof Struct) {
			return ((Struct) t).getKey();
		}
		return null;
	}

	/**
	 * @param term a term
	 * @return the elements of a proper list, or {@code null} when the term is
	 *         a partial list or no list at all
	 */
	public static List<Term> toList(Term term) {
		List<Term> elements = new ArrayList<Term>();
		Term t = term.deref();
		while (t instanceof Struct && ((Struct) t).isListCell()) {
			elements.add(((Struct) t).getArg(0));
			t = ((Struct) t).getArg(1).deref();
		}
		return Atom.NIL.equals(t) ? elements : null;
	}

	/**
	 * @return the unbound variable ending a partial list, or {@code null}
	 */
	public static Variable openTail(Term term) {
		Term t = term.deref();
		while (t instanceof Struct && ((Struct) t).isListCell()) {
			t = ((Struct) t).getArg(1).deref();
		}
		return t instanceof Variable ? (Variable) t : null;
	}
}
