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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.frontend.prolog.PrologProgram;
import org.metricshub.timewarp.jrt.prolog.Bindings;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Continuation of a TW Prolog run: the goals still to prove, the
 * choice-point stack, the trail of bindings, and which directive is
 * running.
 */
public class PrologExecutionState extends ExecutionState {

	private final Bindings bindings;
	private final List<ChoicePoint> choicePoints = new ArrayList<ChoicePoint>();
	private Goal goals;
	private boolean directiveActive;
	private int nextDirective;
	private long solutionCount;

	private Term inputTarget;
	private boolean integerInput;
	private boolean failPending;

	PrologExecutionState(PrologProgram program, TwSettings settings) {
		super(program, settings);
		this.bindings = new Bindings(settings.isOccursCheck());
	}

	public PrologProgram getPrologProgram() {
		return (PrologProgram) getProgram();
	}

	/**
	 * @return number of solutions found so far, over all directives
	 */
	public long getSolutionCount() {
		return solutionCount;
	}

	public int getChoicePointCount() {
		return choicePoints.size();
	}

	Bindings getBindings() {
		return bindings;
	}

	Goal getGoals() {
		return goals;
	}

	void setGoals(Goal goals) {
		this.goals = goals;
	}

	void pushChoicePoint(ChoicePoint choicePoint) {
		choicePoints.add(choicePoint);
	}

	/**
	 * @return the most recent choice point, removed from the stack, or
	 *         {@code null} when there is none
	 */
	ChoicePoint popChoicePoint() {
		return choicePoints.isEmpty() ? null : choicePoints.remove(choicePoints.size() - 1);
	}

	/**
	 * Discards the choice points above {@code height}.
	 */
	void cutTo(int height) {
		while (choicePoints.size() > height) {
			choicePoints.remove(choicePoints.size() - 1);
		}
	}

	boolean isDirectiveActive() {
		return directiveActive;
	}

	void setDirectiveActive(boolean directiveActive) {
		this.directiveActive = directiveActive;
	}

	/**
	 * @return the next directive to run, or {@code null} when all have run
	 */
	Term takeNextDirective() {
		List<Term> directives = getPrologProgram().getGoals();
		return nextDirective < directives.size() ? directives.get(nextDirective++) : null;
	}

	void countSolution() {
		solutionCount++;
	}

	Term getInputTarget() {
		return inputTarget;
	}

	boolean isIntegerInput() {
		return integerInput;
	}

	void setInputTarget(Term target, boolean integer) {
		this.inputTarget = target;
		this.integerInput = integer;
	}

	/**
	 * @return whether the last goal failed, so the next step backtracks
	 */
	boolean isFailPending() {
		return failPending;
	}

	void setFailPending(boolean failPending) {
		this.failPending = failPending;
	}
}
