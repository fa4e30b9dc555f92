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

import java.util.List;
import org.metricshub.timewarp.frontend.prolog.Clause;
import org.metricshub.timewarp.jrt.prolog.Term;

/**
 * Saved resolution state to return to on backtracking.
 */
final class ChoicePoint {

	enum Kind {
		/** Remaining clauses of a predicate call. */
		CLAUSES,
		/** The other branch of a disjunction or an if-then-else. */
		ALTERNATIVE,
		/** End of a {@code findall/3}: deliver the collected list. */
		FINDALL
	}

	private final Kind kind;
	private final int trailMark;
	private final Goal continuation;
	private final Term goal;
	private final List<Clause> clauses;
	private final int nextClause;
	private final Findall findall;

	private ChoicePoint(
			Kind kind,
			int trailMark,
			Goal continuation,
			Term goal,
			List<Clause> clauses,
			int nextClause,
			Findall findall) {
		this.kind = kind;
		this.trailMark = trailMark;
		this.continuation = continuation;
		this.goal = goal;
		this.clauses = clauses;
		this.nextClause = nextClause;
		this.findall = findall;
	}

	static ChoicePoint clauses(int trailMark, Term goal, List<Clause> clauses, int nextClause, Goal continuation) {
		return new ChoicePoint(Kind.CLAUSES, trailMark, continuation, goal, clauses, nextClause, null);
	}

	/**
	 * @param alternative the goals to run instead, continuation included
	 */
	static ChoicePoint alternative(int trailMark, Goal alternative) {
		return new ChoicePoint(Kind.ALTERNATIVE, trailMark, alternative, null, null, 0, null);
	}

	static ChoicePoint findall(int trailMark, Findall findall, Goal continuation) {
		return new ChoicePoint(Kind.FINDALL, trailMark, continuation, null, null, 0, findall);
	}

	Kind getKind() {
		return kind;
	}

	int getTrailMark() {
		return trailMark;
	}

	Goal getContinuation() {
		return continuation;
	}

	Term getGoal() {
		return goal;
	}

	List<Clause> getClauses() {
		return clauses;
	}

	int getNextClause() {
		return nextClause;
	}

	Findall getFindall() {
		return findall;
	}
}
