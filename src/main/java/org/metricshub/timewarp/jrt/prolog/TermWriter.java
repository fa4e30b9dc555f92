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

/**
 * Renders terms the way {@code write/1} shows them: atoms and strings
 * unquoted, lists in bracket notation, operators in operator notation.
 */
public final class TermWriter {

	private TermWriter() {}

	/**
	 * @param term the term
	 * @return its text
	 */
	public static String format(Term term) {
		StringBuilder sb = new StringBuilder();
		write(sb, term, 1200);
		return sb.toString();
	}

	private static void write(StringBuilder sb, Term term, int maxPriority) {
		Term t = term.deref();
		if (t instanceof Variable) {
			sb.append("_G").append(((Variable) t).getId());
		} else if (t instanceof Atom) {
			sb.append(((Atom) t).getName());
		} else if (t instanceof ValueTerm) {
			sb.append(((ValueTerm) t).getValue().format());
		} else {
			writeStruct(sb, (Struct) t, maxPriority);
		}
	}

	private static void writeStruct(StringBuilder sb, Struct s, int maxPriority) {
		if (s.isListCell()) {
			writeList(sb, s);
			return;
		}
		PrologOperators.Definition op = null;
		if (s.getArity() == 2) {
			op = PrologOperators.infix(s.getName());
		} else if (s.getArity() == 1) {
			op = PrologOperators.prefix(s.getName());
		}
		if (op == null) {
			sb.append(s.getName()).append('(');
			for (int i = 0; i < s.getArity(); i++) {
				if (i > 0) {
					sb.append(',');
				}
				write(sb, s.getArg(i), 999);
			}
			sb.append(')');
			return;
		}
		boolean parenthesize = op.getPriority() > maxPriority;
		if (parenthesize) {
			sb.append('(');
		}
		boolean alpha = Character.isLetter(s.getName().charAt(0));
		if (s.getArity() == 2) {
			write(sb, s.getArg(0), op.leftMax());
			if (alpha || "->".equals(s.getName()) || ":-".equals(s.getName())) {
				sb.append(' ').append(s.getName()).append(' ');
			} else {
				sb.append(s.getName());
			}
			write(sb, s.getArg(1), op.rightMax());
		} else {
			sb.append(s.getName());
			Term arg = s.getArg(0).deref();
			if (alpha || arg instanceof ValueTerm || (arg instanceof Struct && !((Struct) arg).isListCell()
					&& PrologOperators.prefix(((Struct) arg).getName()) != null)) {
				sb.append(' ');
			}
			write(sb, arg, op.rightMax());
		}
		if (parenthesize) {
			sb.append(')');
		}
	}

	private static void writeList(StringBuilder sb, Struct list) {
		sb.append('[');
		Term t = list;
		boolean first = true;
		while (t instanceof Struct && ((Struct) t).isListCell()) {
			if (!first) {
				sb.append(',');
			}
			write(sb, ((Struct) t).getArg(0), 999);
			first = false;
			t = ((Struct) t).getArg(1).deref();
		}
		if (!Atom.NIL.equals(t)) {
			sb.append('|');
			write(sb, t, 999);
		}
		sb.append(']');
	}
}
