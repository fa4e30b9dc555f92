package org.metricshub.timewarp.frontend.prolog;

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
import org.metricshub.timewarp.jrt.prolog.Atom;
import org.metricshub.timewarp.jrt.prolog.Struct;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.jrt.prolog.ValueTerm;
import org.metricshub.timewarp.jrt.prolog.Variable;

/**
 * A fact or rule. The stored terms are never bound; each use works on a
 * renamed copy.
 */
public final class Clause implements Serializable {

	private static final long serialVersionUID = 1L;

	private final Term head;
	private final Term body;
	private final int line;

	public Clause(Term head, Term body, int line) {
		this.head = head;
		this.body = body;
		this.line = line;
	}

	public Term getHead() {
		return head;
	}

	/**
	 * @return the body, {@link Atom#TRUE} for a fact
	 */
	public Term getBody() {
		return body;
	}

	public boolean isFact() {
		return Atom.TRUE.equals(body);
	}

	public int getLine() {
		return line;
	}

	/**
	 * Cheap pre-unification test on the first argument, used to avoid
	 * leaving choice points behind clauses that cannot match.
	 *
	 * @param goal the goal being resolved
	 * @return {@code false} only when the head certainly does not unify
	 */
	public boolean mightMatch(Term goal) {
		Term g = goal.deref();
		if (!(g instanceof Struct) || !(head instanceof Struct)) {
			return true;
		}
		Term a = ((Struct) g).getArg(0).deref();
		Term b = ((Struct) head).getArg(0);
		if (a instanceof Variable || b instanceof Variable) {
			return true;
		}
		if (a instanceof Struct) {
			return b instanceof Struct && ((Struct) a).getKey().equals(((Struct) b).getKey());
		}
		if (a instanceof ValueTerm || a instanceof Atom) {
			return a.identical(b);
		}
		return true;
	}
}
