package org.metricshub.timewarp.backend;

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

import org.metricshub.timewarp.jrt.prolog.Term;

/**
 * Node of the goal continuation: the goals still to prove, as an immutable
 * linked list shared between choice points.
 */
final class Goal {

	private final Term term;
	private final int cutBarrier;
	private final Findall collector;
	private final Goal next;

	/**
	 * @param term goal to prove
	 * @param cutBarrier choice-point stack height a cut in this goal returns to
	 * @param next remaining goals
	 */
	Goal(Term term, int cutBarrier, Goal next) {
		this(term, cutBarrier, null, next);
	}

	private Goal(Term term, int cutBarrier, Findall collector, Goal next) {
		this.term = term;
		this.cutBarrier = cutBarrier;
		this.collector = collector;
		this.next = next;
	}

	/**
	 * A goal that records one {@code findall/3} solution and fails.
	 */
	static Goal collect(Findall findall) {
		return new Goal(null, 0, findall, null);
	}

	Term getTerm() {
		return term;
	}

	int getCutBarrier() {
		return cutBarrier;
	}

	/**
	 * @return the collector of a {@link #collect(Findall)} goal, else {@code null}
	 */
	Findall getCollector() {
		return collector;
	}

	Goal getNext() {
		return next;
	}
}
