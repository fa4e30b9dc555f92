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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.timewarp.frontend.Lexer;
import org.metricshub.timewarp.frontend.LexerSpec;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.frontend.Token;
import org.metricshub.timewarp.frontend.TokenStream;
import org.metricshub.timewarp.frontend.TokenType;
import org.metricshub.timewarp.jrt.prolog.Atom;
import org.metricshub.timewarp.jrt.prolog.PrologOperators;
import org.metricshub.timewarp.jrt.prolog.Struct;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.jrt.prolog.Terms;
import org.metricshub.timewarp.jrt.prolog.ValueTerm;
import org.metricshub.timewarp.jrt.prolog.Variable;

/**
 * Operator-precedence reader for TW Prolog programs.
 * <p>
 * A program is a sequence of clauses and directives, each ending with a
 * full stop. Turbo Prolog style section headers ({@code domains},
 * {@code predicates}, {@code clauses}, {@code goal}) are recognized when they
 * stand alone on their line. Declarations in the {@code domains} and
 * {@code predicates} sections are skipped, and the text of the {@code goal}
 * section is a directive.
 */
public class PrologParser {

	static final LexerSpec LEXER_SPEC = LexerSpec
			.builder("TW Prolog")
			.caseSensitive(true)
			.operators(
					":-", "?-", "-->", "->", "\\+", "\\==", "\\=", "=:=", "=\\=", "=<", ">=", "==", "=..", "=", "<", ">",
					"**", "//", "+", "-", "*", "/", "(", ")", "[", "]", "|", ",", ";", "!", ".")
			.lineComment("%")
			.blockComment("/*", "*/")
			.quote('\'', TokenType.QUOTED, LexerSpec.EscapeStyle.BACKSLASH)
			.quote('"', TokenType.STRING, LexerSpec.EscapeStyle.BACKSLASH)
			.build();

	private enum Section {
		DOMAINS,
		PREDICATES,
		CLAUSES,
		GOAL
	}

	private final String sourceDescription;

	private TokenStream ts;
	private Map<String, Variable> variables;

	/**
	 * @param sourceDescription name of the program text, reported in errors
	 */
	public PrologParser(String sourceDescription) {
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Reads a whole program.
	 *
	 * @param source program text
	 * @return the program
	 * @throws ParserException when the text is not valid TW Prolog
	 */
	public PrologProgram parse(String source) {
		ts = new TokenStream(new Lexer(LEXER_SPEC, sourceDescription).tokenize(source), sourceDescription);
		Map<String, List<Clause>> database = new LinkedHashMap<String, List<Clause>>();
		List<Term> goals = new ArrayList<Term>();
		Section section = Section.CLAUSES;

		while (!ts.atEnd()) {
			Section header = sectionHeader();
			if (header != null) {
				ts.next();
				section = header;
				continue;
			}
			if (section == Section.DOMAINS || section == Section.PREDICATES) {
				ts.next();
				continue;
			}
			Token start = ts.peek();
			Term term = readClause();
			if (section == Section.GOAL) {
				goals.add(term);
			} else if (isDirective(term)) {
				goals.add(((Struct) term).getArg(0));
			} else {
				Clause clause = clause(term, start);
				String key = Terms.key(clause.getHead());
				List<Clause> clauses = database.get(key);
				if (clauses == null) {
					clauses = new ArrayList<Clause>();
					database.put(key, clauses);
				}
				clauses.add(clause);
			}
		}
		return new PrologProgram(sourceDescription, database, goals);
	}

	/**
	 * Reads one term followed by a full stop, as used for a clause or a query.
	 */
	Term readClause() {
		variables = new HashMap<String, Variable>();
		Term term = read(1200);
		ts.expectSymbol(".");
		return term;
	}

	private Section sectionHeader() {
		Token t = ts.peek();
		if (t.getType() != TokenType.WORD) {
			return null;
		}
		Token after = ts.peek(1);
		if (after.getType() != TokenType.EOF && after.getLine() == t.getLine()) {
			return null;
		}
		String word = t.getText().toLowerCase(Locale.ROOT);
		if ("domains".equals(word)) {
			return Section.DOMAINS;
		} else if ("predicates".equals(word)) {
			return Section.PREDICATES;
		} else if ("clauses".equals(word)) {
			return Section.CLAUSES;
		} else if ("goal".equals(word)) {
			return Section.GOAL;
		}
		return null;
	}

	private static boolean isDirective(Term term) {
		if (!(term instanceof Struct)) {
			return false;
		}
		Struct s = (Struct) term;
		return s.getArity() == 1 && (":-".equals(s.getName()) || "?-".equals(s.getName()));
	}

	private Clause clause(Term term, Token start) {
		Term head = term;
		Term body = Atom.TRUE;
		if (term instanceof Struct && ((Struct) term).getArity() == 2 && ":-".equals(((Struct) term).getName())) {
			head = ((Struct) term).getArg(0);
			body = ((Struct) term).getArg(1);
		}
		if (!(head instanceof Atom) && !(head instanceof Struct)) {
			throw ts.error(start, "Clause head must be an atom or a compound term, found " + head);
		}
		String key = Terms.key(head);
		if (",/2".equals(key) || ";/2".equals(key) || "->/2".equals(key) || "!/0".equals(key)) {
			throw ts.error(start, "Cannot redefine the control construct " + key);
		}
		if (body instanceof ValueTerm) {
			throw ts.error(start, "Clause body is not callable: " + body);
		}
		return new Clause(head, body, start.getLine());
	}

	// terms

	private Term read(int maxPriority) {
		Token t = ts.next();
		Term left;
		int leftPriority = 0;
		switch (t.getType()) {
		case NUMBER:
			left = ValueTerm.number(Double.parseDouble(t.getText()));
			break;
		case STRING:
			left = ValueTerm.text(t.getText());
			break;
		case QUOTED:
			left = ts.isSymbol("(") ? compound(t.getText()) : new Atom(t.getText());
			break;
		case WORD:
			if (isVariableName(t.getText())) {
				left = variable(t.getText());
			} else if (ts.isSymbol("(")) {
				left = compound(t.getText());
			} else {
				left = new Atom(t.getText());
			}
			break;
		case SYMBOL:
			if ("(".equals(t.getText())) {
				left = read(1200);
				ts.expectSymbol(")");
			} else if ("[".equals(t.getText())) {
				left = list();
			} else if ("!".equals(t.getText())) {
				left = Atom.CUT;
			} else if (adjacent(t, ts.peek()) && ts.isSymbol("(")) {
				left = compound(t.getText());
			} else if ("-".equals(t.getText()) && ts.peek().getType() == TokenType.NUMBER && adjacent(t, ts.peek())) {
				left = ValueTerm.number(-Double.parseDouble(ts.next().getText()));
			} else if (PrologOperators.prefix(t.getText()) != null && canStartTerm(ts.peek())) {
				PrologOperators.Definition op = PrologOperators.prefix(t.getText());
				left = new Struct(t.getText(), read(Math.min(op.rightMax(), maxPriority)));
				leftPriority = op.getPriority();
			} else if (isSymbolAtom(t.getText())) {
				left = new Atom(t.getText());
			} else {
				throw ts.error(t, "Unexpected " + t);
			}
			break;
		default:
			throw ts.error(t, "Unexpected " + t);
		}

		while (true) {
			Token next = ts.peek();
			if (next.getType() != TokenType.SYMBOL && next.getType() != TokenType.WORD) {
				return left;
			}
			PrologOperators.Definition op = PrologOperators.infix(next.getText());
			if (op == null || op.getPriority() > maxPriority || leftPriority > op.leftMax()) {
				return left;
			}
			ts.next();
			Term right = read(op.rightMax());
			left = new Struct(op.getName(), left, right);
			leftPriority = op.getPriority();
		}
	}

	private static boolean isVariableName(String name) {
		char c = name.charAt(0);
		return c == '_' || Character.isUpperCase(c);
	}

	private Term variable(String name) {
		if ("_".equals(name)) {
			return new Variable("_");
		}
		Variable v = variables.get(name);
		if (v == null) {
			v = new Variable(name);
			variables.put(name, v);
		}
		return v;
	}

	private Term compound(String name) {
		ts.expectSymbol("(");
		List<Term> args = new ArrayList<Term>();
		do {
			args.add(read(999));
		} while (ts.acceptSymbol(","));
		ts.expectSymbol(")");
		return new Struct(name, args.toArray(new Term[0]));
	}

	private Term list() {
		if (ts.acceptSymbol("]")) {
			return Atom.NIL;
		}
		List<Term> elements = new ArrayList<Term>();
		do {
			elements.add(read(999));
		} while (ts.acceptSymbol(","));
		Term tail = Atom.NIL;
		if (ts.acceptSymbol("|")) {
			tail = read(999);
		}
		ts.expectSymbol("]");
		return Struct.list(elements, tail);
	}

	private static boolean adjacent(Token a, Token b) {
		return a.getLine() == b.getLine() && a.getColumn() + a.getText().length() == b.getColumn();
	}

	private static boolean canStartTerm(Token t) {
		switch (t.getType()) {
		case NUMBER:
		case STRING:
		case QUOTED:
			return true;
		case WORD:
			return PrologOperators.infix(t.getText()) == null;
		case SYMBOL:
			String s = t.getText();
			return "(".equals(s) || "[".equals(s) || "!".equals(s) || PrologOperators.prefix(s) != null;
		default:
			return false;
		}
	}

	private static boolean isSymbolAtom(String text) {
		return PrologOperators.infix(text) != null || PrologOperators.prefix(text) != null || "=..".equals(text);
	}
}
