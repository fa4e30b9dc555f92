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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.frontend.prolog.Clause;
import org.metricshub.timewarp.frontend.prolog.PrologLibrary;
import org.metricshub.timewarp.frontend.prolog.PrologProgram;
import org.metricshub.timewarp.jrt.IOChannel;
import org.metricshub.timewarp.jrt.Operators;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;
import org.metricshub.timewarp.jrt.prolog.Atom;
import org.metricshub.timewarp.jrt.prolog.Bindings;
import org.metricshub.timewarp.jrt.prolog.Struct;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.jrt.prolog.Terms;
import org.metricshub.timewarp.jrt.prolog.ValueTerm;
import org.metricshub.timewarp.jrt.prolog.Variable;
import org.metricshub.timewarp.util.TwLogger;
import org.metricshub.timewarp.util.TwSettings;
import org.slf4j.Logger;

/**
 * SLD resolution over a TW Prolog clause database.
 * <p>
 * Resolution never recurses on the Java stack. The goals still to prove
 * form a linked continuation, and alternatives are saved as
 * {@link ChoicePoint}s together with the trail height to undo to. One call
 * to {@link #execute(ExecutionState)} performs resolution steps until an
 * event is queued, so output reaches the host as it is produced.
 * <p>
 * Each directive runs to exhaustion: after every solution the engine
 * backtracks into the remaining choice points. When the last directive has
 * no choice point left, the run completes with
 * {@link ExecutionEvent.CompletionReason#NO_MORE_SOLUTIONS}.
 * <p>
 * A cut removes the choice points created since its clause was called.
 * {@code call/1}, the condition of {@code ->} and the goal of {@code \+}
 * are opaque to cut.
 */
public class PrologInterpreter implements Interpreter {

	private static final Logger LOG = TwLogger.getLogger(PrologInterpreter.class);

	private static final Atom FAIL = new Atom("fail");

	@Override
	public ExecutionState start(Program program, TwSettings settings) {
		return new PrologExecutionState((PrologProgram) program, settings);
	}

	@Override
	public void execute(ExecutionState executionState) {
		PrologExecutionState state = (PrologExecutionState) executionState;
		IOChannel channel = state.getChannel();
		while (!channel.hasEvents() && !channel.isAwaitingInput() && !state.isTerminated()) {
			if (state.isAborted()) {
				return;
			}
			state.countInstruction();
			step(state);
		}
	}

	private void step(PrologExecutionState state) {
		if (state.isFailPending()) {
			state.setFailPending(false);
			backtrack(state);
			return;
		}
		if (!state.isDirectiveActive()) {
			Term directive = state.takeNextDirective();
			if (directive == null) {
				state.complete(ExecutionEvent.CompletionReason.NO_MORE_SOLUTIONS);
				return;
			}
			state.setDirectiveActive(true);
			state.setGoals(new Goal(directive.copy(new HashMap<Variable, Variable>()), 0, null));
			return;
		}
		Goal goal = state.getGoals();
		if (goal == null) {
			state.countSolution();
			LOG.debug("Solution {} found", state.getSolutionCount());
			state.setFailPending(true);
			return;
		}
		state.setGoals(goal.getNext());
		if (goal.getCollector() != null) {
			goal.getCollector().collect();
			state.setFailPending(true);
			return;
		}
		solve(state, goal);
	}

	private void solve(PrologExecutionState state, Goal goal) {
		Term term = goal.getTerm().deref();
		if (term instanceof Variable) {
			throw new TwRuntimeException(RuntimeErrorKind.INSTANTIATION, "Arguments are not sufficiently instantiated");
		}
		if (term instanceof ValueTerm) {
			throw new TwRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, "Cannot call " + term);
		}
		String key = Terms.key(term);
		Term[] args = arguments(term);
		int barrier = goal.getCutBarrier();
		Goal next = goal.getNext();

		if ("true/0".equals(key)) {
			return;
		} else if ("fail/0".equals(key) || "false/0".equals(key)) {
			state.setFailPending(true);
		} else if (",/2".equals(key)) {
			state.setGoals(new Goal(args[0], barrier, new Goal(args[1], barrier, next)));
		} else if ("!/0".equals(key)) {
			state.cutTo(barrier);
		} else if (";/2".equals(key)) {
			Term left = args[0].deref();
			if (left instanceof Struct && "->/2".equals(((Struct) left).getKey())) {
				ifThenElse(state, ((Struct) left).getArg(0), ((Struct) left).getArg(1), args[1], barrier, next);
			} else {
				state.pushChoicePoint(
						ChoicePoint.alternative(state.getBindings().mark(), new Goal(args[1], barrier, next)));
				state.setGoals(new Goal(left, barrier, next));
			}
		} else if ("->/2".equals(key)) {
			ifThenElse(state, args[0], args[1], FAIL, barrier, next);
		} else if ("\\+/1".equals(key) || "not/1".equals(key)) {
			ifThenElse(state, args[0], FAIL, Atom.TRUE, barrier, next);
		} else if ("call/1".equals(key)) {
			state.setGoals(new Goal(args[0], state.getChoicePointCount(), next));
		} else if ("findall/3".equals(key)) {
			Findall findall = new Findall(args[0], args[2]);
			state.pushChoicePoint(ChoicePoint.findall(state.getBindings().mark(), findall, next));
			state.setGoals(new Goal(args[1], state.getChoicePointCount(), Goal.collect(findall)));
		} else {
			PrologBuiltins.Builtin builtin = PrologBuiltins.get(key);
			if (builtin != null) {
				if (!builtin.call(state, args)) {
					state.setFailPending(true);
				}
			} else {
				callPredicate(state, term, key, next);
			}
		}
	}

	private static Term[] arguments(Term term) {
		if (term instanceof Struct) {
			Struct s = (Struct) term;
			Term[] args = new Term[s.getArity()];
			for (int i = 0; i < args.length; i++) {
				args[i] = s.getArg(i);
			}
			return args;
		}
		return new Term[0];
	}

	/**
	 * {@code (Cond -> Then ; Else)}: the else branch is saved as a choice
	 * point, and a cut placed after the condition removes it together with
	 * the condition's own choice points.
	 */
	private static void ifThenElse(
			PrologExecutionState state,
			Term condition,
			Term then,
			Term otherwise,
			int barrier,
			Goal next) {
		int mark = state.getChoicePointCount();
		state.pushChoicePoint(ChoicePoint.alternative(state.getBindings().mark(), new Goal(otherwise, barrier, next)));
		Goal commit = new Goal(Atom.CUT, mark, new Goal(then, barrier, next));
		state.setGoals(new Goal(condition, state.getChoicePointCount(), commit));
	}

	private void callPredicate(PrologExecutionState state, Term goal, String key, Goal next) {
		List<Clause> clauses = state.getPrologProgram().getClauses(key);
		if (clauses == null) {
			clauses = PrologLibrary.getClauses(key);
		}
		if (clauses == null) {
			throw new TwRuntimeException(RuntimeErrorKind.UNDEFINED_PREDICATE, "Undefined predicate " + key);
		}
		tryClauses(state, goal, clauses, 0, next);
	}

	/**
	 * Resolves the goal with the first matching clause from {@code from} on,
	 * leaving a choice point when a later clause might match too.
	 */
	private void tryClauses(PrologExecutionState state, Term goal, List<Clause> clauses, int from, Goal next) {
		Bindings bindings = state.getBindings();
		int height = state.getChoicePointCount();
		for (int i = from; i < clauses.size(); i++) {
			Clause clause = clauses.get(i);
			if (!clause.mightMatch(goal)) {
				continue;
			}
			// looked up before the head binds the goal's arguments
			int alternative = nextCandidate(clauses, i + 1, goal);
			int mark = bindings.mark();
			Map<Variable, Variable> renaming = new HashMap<Variable, Variable>();
			if (bindings.unify(clause.getHead().copy(renaming), goal)) {
				if (alternative >= 0) {
					state.pushChoicePoint(ChoicePoint.clauses(mark, goal, clauses, alternative, next));
				}
				if (clause.isFact()) {
					state.setGoals(next);
				} else {
					state.setGoals(new Goal(clause.getBody().copy(renaming), height, next));
				}
				return;
			}
			bindings.undo(mark);
		}
		state.setFailPending(true);
	}

	private static int nextCandidate(List<Clause> clauses, int from, Term goal) {
		for (int i = from; i < clauses.size(); i++) {
			if (clauses.get(i).mightMatch(goal)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Resumes the most recent choice point. With none left, the current
	 * directive is exhausted.
	 */
	private void backtrack(PrologExecutionState state) {
		ChoicePoint choicePoint = state.popChoicePoint();
		if (choicePoint == null) {
			state.getBindings().undo(0);
			state.setGoals(null);
			state.setDirectiveActive(false);
			return;
		}
		state.getBindings().undo(choicePoint.getTrailMark());
		switch (choicePoint.getKind()) {
		case CLAUSES:
			tryClauses(
					state,
					choicePoint.getGoal(),
					choicePoint.getClauses(),
					choicePoint.getNextClause(),
					choicePoint.getContinuation());
			break;
		case ALTERNATIVE:
			state.setGoals(choicePoint.getContinuation());
			break;
		case FINDALL: {
			Findall findall = choicePoint.getFindall();
			if (PrologBuiltins.unify(state, findall.getResult(), findall.toList())) {
				state.setGoals(choicePoint.getContinuation());
			} else {
				state.setFailPending(true);
			}
			break;
		}
		default:
			throw new IllegalStateException("Unknown choice point " + choicePoint.getKind());
		}
	}

	@Override
	public void provideInput(ExecutionState executionState, String text) {
		PrologExecutionState state = (PrologExecutionState) executionState;
		Term target = state.getInputTarget();
		Term value;
		if (state.isIntegerInput()) {
			Double number = Operators.parseNumber(text);
			if (number == null || !Value.isIntegral(number.doubleValue())) {
				state.repeatInputRequest();
				return;
			}
			value = ValueTerm.number(number.doubleValue());
		} else {
			value = ValueTerm.text(text);
		}
		state.setInputTarget(null, false);
		if (!PrologBuiltins.unify(state, target, value)) {
			state.setFailPending(true);
		}
	}
}
