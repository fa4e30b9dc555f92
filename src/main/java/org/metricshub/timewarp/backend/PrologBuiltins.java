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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.jrt.Operators;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.prolog.Atom;
import org.metricshub.timewarp.jrt.prolog.Bindings;
import org.metricshub.timewarp.jrt.prolog.Struct;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.jrt.prolog.TermWriter;
import org.metricshub.timewarp.jrt.prolog.Terms;
import org.metricshub.timewarp.jrt.prolog.ValueTerm;
import org.metricshub.timewarp.jrt.prolog.Variable;

/**
 * Deterministic built-in predicates, keyed by {@code name/arity}. Control
 * constructs and {@code findall/3} are handled by {@link PrologInterpreter}
 * itself, and the enumerating list predicates come from the Prolog library.
 */
final class PrologBuiltins {

	/** A built-in predicate. */
	interface Builtin {
		/**
		 * @param state the run
		 * @param args the goal's arguments
		 * @return {@code false} to fail
		 */
		boolean call(PrologExecutionState state, Term[] args);
	}

	private static final Map<String, Builtin> BUILTINS = new HashMap<String, Builtin>();

	static {
		BUILTINS.put("=/2", (state, args) -> unify(state, args[0], args[1]));
		BUILTINS.put("\\=/2", (state, args) -> !state.getBindings().unifiable(args[0], args[1]));
		BUILTINS.put("==/2", (state, args) -> args[0].identical(args[1]));
		BUILTINS.put("\\==/2", (state, args) -> !args[0].identical(args[1]));
		BUILTINS.put(
				"is/2",
				(state, args) -> unify(state, args[0], new ValueTerm(PrologArithmetic.evaluate(args[1]))));
		BUILTINS.put("=:=/2", (state, args) -> compare(args) == 0);
		BUILTINS.put("=\\=/2", (state, args) -> compare(args) != 0);
		BUILTINS.put("</2", (state, args) -> compare(args) < 0);
		BUILTINS.put(">/2", (state, args) -> compare(args) > 0);
		BUILTINS.put("=</2", (state, args) -> compare(args) <= 0);
		BUILTINS.put(">=/2", (state, args) -> compare(args) >= 0);

		BUILTINS.put("var/1", (state, args) -> args[0].deref() instanceof Variable);
		BUILTINS.put("nonvar/1", (state, args) -> !(args[0].deref() instanceof Variable));
		BUILTINS.put("atom/1", (state, args) -> args[0].deref() instanceof Atom);
		BUILTINS.put("number/1", (state, args) -> isNumber(args[0]));
		BUILTINS.put(
				"integer/1",
				(state, args) -> args[0].deref() instanceof ValueTerm && ((ValueTerm) args[0].deref()).isInteger());
		BUILTINS.put("is_list/1", (state, args) -> Terms.toList(args[0]) != null);

		BUILTINS.put("write/1", PrologBuiltins::write);
		BUILTINS.put("print/1", PrologBuiltins::write);
		BUILTINS.put("writeln/1", (state, args) -> {
			write(state, args);
			state.flushOutput(true);
			return true;
		});
		BUILTINS.put("nl/0", (state, args) -> {
			state.flushOutput(true);
			return true;
		});
		BUILTINS.put("tab/1", (state, args) -> {
			int count = Operators.toIndex(PrologArithmetic.evaluate(args[0]));
			StringBuilder spaces = new StringBuilder();
			for (int i = 0; i < count; i++) {
				spaces.append(' ');
			}
			state.appendOutput(spaces.toString());
			return true;
		});
		BUILTINS.put("readln/1", (state, args) -> read(state, args[0], false));
		BUILTINS.put("readint/1", (state, args) -> read(state, args[0], true));
		BUILTINS.put("halt/0", (state, args) -> {
			state.complete(ExecutionEvent.CompletionReason.HALTED);
			return true;
		});

		BUILTINS.put("length/2", PrologBuiltins::length);
		BUILTINS.put("reverse/2", (state, args) -> {
			List<Term> elements = properList(args[0]);
			List<Term> reversed = new ArrayList<Term>(elements);
			Collections.reverse(reversed);
			return unify(state, args[1], Struct.list(reversed, Atom.NIL));
		});
	}

	private PrologBuiltins() {}

	/**
	 * @param key {@code name/arity}
	 * @return the built-in, or {@code null}
	 */
	static Builtin get(String key) {
		return BUILTINS.get(key);
	}

	/**
	 * Unifies, undoing partial bindings when unification fails.
	 */
	static boolean unify(PrologExecutionState state, Term a, Term b) {
		Bindings bindings = state.getBindings();
		int mark = bindings.mark();
		if (bindings.unify(a, b)) {
			return true;
		}
		bindings.undo(mark);
		return false;
	}

	private static int compare(Term[] args) {
		return Operators.compare(PrologArithmetic.evaluate(args[0]), PrologArithmetic.evaluate(args[1]));
	}

	private static boolean isNumber(Term term) {
		Term t = term.deref();
		return t instanceof ValueTerm && ((ValueTerm) t).isNumber();
	}

	private static boolean write(PrologExecutionState state, Term[] args) {
		state.appendOutput(TermWriter.format(args[0]));
		return true;
	}

	private static boolean read(PrologExecutionState state, Term target, boolean integer) {
		state.setInputTarget(target, integer);
		state.requestInput(null);
		return true;
	}

	private static List<Term> properList(Term term) {
		List<Term> elements = Terms.toList(term);
		if (elements == null) {
			if (Terms.openTail(term) != null) {
				throw new TwRuntimeException(RuntimeErrorKind.INSTANTIATION, "Arguments are not sufficiently instantiated");
			}
			throw new TwRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, "Expected a list, found " + term);
		}
		return elements;
	}

	/**
	 * Counts a proper list, or completes a partial list to a known length.
	 */
	private static boolean length(PrologExecutionState state, Term[] args) {
		List<Term> elements = Terms.toList(args[0]);
		if (elements != null) {
			return unify(state, args[1], ValueTerm.number(elements.size()));
		}
		Variable tail = Terms.openTail(args[0]);
		Term n = args[1].deref();
		if (tail == null) {
			throw new TwRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, "Expected a list, found " + args[0]);
		}
		if (!(n instanceof ValueTerm) || !((ValueTerm) n).isInteger()) {
			throw new TwRuntimeException(RuntimeErrorKind.INSTANTIATION, "Arguments are not sufficiently instantiated");
		}
		int known = 0;
		Term t = args[0].deref();
		while (t instanceof Struct && ((Struct) t).isListCell()) {
			known++;
			t = ((Struct) t).getArg(1).deref();
		}
		int missing = (int) ((ValueTerm) n).getValue().asNumber() - known;
		if (missing < 0) {
			return false;
		}
		List<Term> fresh = new ArrayList<Term>();
		for (int i = 0; i < missing; i++) {
			fresh.add(new Variable(null));
		}
		return unify(state, tail, Struct.list(fresh, Atom.NIL));
	}
}
