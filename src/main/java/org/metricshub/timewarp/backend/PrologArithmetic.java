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

import org.metricshub.timewarp.jrt.Operators;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;
import org.metricshub.timewarp.jrt.prolog.Atom;
import org.metricshub.timewarp.jrt.prolog.Struct;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.jrt.prolog.ValueTerm;
import org.metricshub.timewarp.jrt.prolog.Variable;

/**
 * Evaluation of arithmetic expressions for {@code is/2} and the arithmetic
 * comparisons.
 */
final class PrologArithmetic {

	private PrologArithmetic() {}

	/**
	 * @param expression the expression
	 * @return its numeric value
	 * @throws TwRuntimeException {@code INSTANTIATION} on an unbound variable,
	 *         {@code TYPE_MISMATCH} on anything that is not an expression
	 */
	static Value evaluate(Term expression) {
		Term t = expression.deref();
		if (t instanceof Variable) {
			throw new TwRuntimeException(RuntimeErrorKind.INSTANTIATION, "Arguments are not sufficiently instantiated");
		}
		if (t instanceof ValueTerm) {
			Value value = ((ValueTerm) t).getValue();
			if (!value.isNumber()) {
				throw notEvaluable(t);
			}
			return value;
		}
		if (t instanceof Atom) {
			String name = ((Atom) t).getName();
			if ("pi".equals(name)) {
				return Value.number(Math.PI);
			} else if ("e".equals(name)) {
				return Value.number(Math.E);
			}
			throw notEvaluable(t);
		}
		Struct s = (Struct) t;
		if (s.getArity() == 1) {
			return unary(s, evaluate(s.getArg(0)).asNumber());
		}
		if (s.getArity() == 2) {
			return binary(s, evaluate(s.getArg(0)), evaluate(s.getArg(1)));
		}
		throw notEvaluable(t);
	}

	private static Value unary(Struct s, double x) {
		String name = s.getName();
		double result;
		if ("-".equals(name)) {
			result = -x;
		} else if ("+".equals(name)) {
			result = x;
		} else if ("abs".equals(name)) {
			result = Math.abs(x);
		} else if ("sign".equals(name)) {
			result = Math.signum(x);
		} else if ("sqrt".equals(name)) {
			result = Math.sqrt(x);
		} else if ("sin".equals(name)) {
			result = Math.sin(x);
		} else if ("cos".equals(name)) {
			result = Math.cos(x);
		} else if ("tan".equals(name)) {
			result = Math.tan(x);
		} else if ("atan".equals(name)) {
			result = Math.atan(x);
		} else if ("exp".equals(name)) {
			result = Math.exp(x);
		} else if ("log".equals(name)) {
			result = Math.log(x);
		} else if ("floor".equals(name)) {
			result = Math.floor(x);
		} else if ("ceiling".equals(name)) {
			result = Math.ceil(x);
		} else if ("round".equals(name)) {
			result = Math.signum(x) * Math.floor(Math.abs(x) + 0.5);
		} else if ("truncate".equals(name) || "integer".equals(name)) {
			result = x < 0 ? Math.ceil(x) : Math.floor(x);
		} else {
			throw notEvaluable(s);
		}
		return Value.number(result);
	}

	private static Value binary(Struct s, Value x, Value y) {
		String name = s.getName();
		if ("+".equals(name)) {
			return Operators.add(x, y);
		} else if ("-".equals(name)) {
			return Operators.subtract(x, y);
		} else if ("*".equals(name)) {
			return Operators.multiply(x, y);
		} else if ("/".equals(name)) {
			return Operators.divide(x, y);
		} else if ("//".equals(name)) {
			return Operators.intDivide(x, y);
		} else if ("mod".equals(name)) {
			return Operators.modulo(x, y);
		} else if ("**".equals(name) || "^".equals(name)) {
			return Operators.power(x, y);
		} else if ("min".equals(name)) {
			return Value.number(Math.min(x.asNumber(), y.asNumber()));
		} else if ("max".equals(name)) {
			return Value.number(Math.max(x.asNumber(), y.asNumber()));
		}
		throw notEvaluable(s);
	}

	private static TwRuntimeException notEvaluable(Term t) {
		return new TwRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, "Cannot evaluate " + t + " as a number");
	}
}
