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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Unification with a trail of bound variables.
 * <p>
 * {@link #mark()} returns the current trail height and {@link #undo(int)}
 * unbinds every variable bound since, which is how a choice point restores
 * the bindings it saw.
 */
public class Bindings {

	private final List<Variable> trail = new ArrayList<Variable>();
	private final boolean occursCheck;

	/**
	 * @param occursCheck whether binding a variable to a term containing it
	 *        fails
	 */
	public Bindings(boolean occursCheck) {
		this.occursCheck = occursCheck;
	}

	public boolean isOccursCheck() {
		return occursCheck;
	}

	public int mark() {
		return trail.size();
	}

	public void undo(int mark) {
		for (int i = trail.size() - 1; i >= mark; i--) {
			trail.remove(i).unbind();
		}
	}

	/**
	 * Makes two terms equal by binding variables. Bindings made by a failed
	 * unification stay on the trail; the caller undoes them to its mark.
	 *
	 * @param a first term
	 * @param b second term
	 * @return {@code true} on success
	 */
	public boolean unify(Term a, Term b) {
		Deque<Term> pending = new ArrayDeque<Term>();
		pending.push(b);
		pending.push(a);
		while (!pending.isEmpty()) {
			Term x = pending.pop().deref();
			Term y = pending.pop().deref();
			if (x == y) {
				continue;
			}
			if (x instanceof Variable) {
				if (!bind((Variable) x, y)) {
					return false;
				}
			} else if (y instanceof Variable) {
				if (!bind((Variable) y, x)) {
					return false;
				}
			} else if (x instanceof Struct) {
				if (!(y instanceof Struct)) {
					return false;
				}
				Struct sx = (Struct) x;
				Struct sy = (Struct) y;
				if (sx.getArity() != sy.getArity() || !sx.getName().equals(sy.getName())) {
					return false;
				}
				for (int i = sx.getArity() - 1; i >= 0; i--) {
					pending.push(sy.getArg(i));
					pending.push(sx.getArg(i));
				}
			} else if (!x.identical(y)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Tests whether two terms unify without keeping any binding.
	 */
	public boolean unifiable(Term a, Term b) {
		int mark = mark();
		boolean result = unify(a, b);
		undo(mark);
		return result;
	}

	private boolean bind(Variable variable, Term term) {
		if (occursCheck && occurs(variable, term)) {
			return false;
		}
		variable.bind(term);
		trail.add(variable);
		return true;
	}

	private static boolean occurs(Variable variable, Term term) {
		Deque<Term> pending = new ArrayDeque<Term>();
		pending.push(term);
		while (!pending.isEmpty()) {
			Term t = pending.pop().deref();
			if (t == variable) {
				return true;
			}
			if (t instanceof Struct) {
				Struct s = (Struct) t;
				for (int i = 0; i < s.getArity(); i++) {
					pending.push(s.getArg(i));
				}
			}
		}
		return false;
	}
}
