package org.metricshub.timewarp.frontend.pascal;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.timewarp.frontend.Lexer;
import org.metricshub.timewarp.frontend.LexerSpec;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.frontend.Token;
import org.metricshub.timewarp.frontend.TokenStream;
import org.metricshub.timewarp.frontend.TokenType;
import org.metricshub.timewarp.intermediate.Address;
import org.metricshub.timewarp.intermediate.Builtin;
import org.metricshub.timewarp.intermediate.Opcode;
import org.metricshub.timewarp.intermediate.TupleProgram;
import org.metricshub.timewarp.jrt.Value;

/**
 * Single-pass compiler from TW Pascal to instruction tuples.
 * <p>
 * Every identifier is resolved while parsing: loop-scoped {@code for}
 * variables first, then the locals of the routine being compiled, then the
 * globals. An identifier that resolves to nothing is a parse error.
 * Routines may only call routines declared before them (or themselves).
 */
public class PascalParser {

	static final LexerSpec LEXER_SPEC = LexerSpec
			.builder("TW Pascal")
			.caseSensitive(false)
			.keywords(
					"PROGRAM", "USES", "CONST", "VAR", "TYPE", "PROCEDURE", "FUNCTION", "BEGIN", "END", "IF", "THEN",
					"ELSE", "WHILE", "DO", "REPEAT", "UNTIL", "FOR", "TO", "DOWNTO", "CASE", "OF", "OTHERWISE", "ARRAY",
					"AND", "OR", "NOT", "DIV", "MOD", "TRUE", "FALSE")
			.operators(":=", "<=", ">=", "<>", "..", "=", "<", ">", "+", "-", "*", "/", "(", ")", "[", "]", ",", ";", ":", ".")
			.lineComment("//")
			.blockComment("{", "}")
			.blockComment("(*", "*)")
			.quote('\'', TokenType.STRING, LexerSpec.EscapeStyle.DOUBLED_QUOTE)
			.build();

	private static final Map<String, Builtin> FUNCTIONS = new HashMap<String, Builtin>();

	static {
		FUNCTIONS.put("ABS", Builtin.ABS);
		FUNCTIONS.put("SQR", Builtin.SQUARE);
		FUNCTIONS.put("SQRT", Builtin.SQRT);
		FUNCTIONS.put("SIN", Builtin.SIN);
		FUNCTIONS.put("COS", Builtin.COS);
		FUNCTIONS.put("ARCTAN", Builtin.ATN);
		FUNCTIONS.put("EXP", Builtin.EXP);
		FUNCTIONS.put("LN", Builtin.LOG);
		FUNCTIONS.put("ROUND", Builtin.ROUND);
		FUNCTIONS.put("TRUNC", Builtin.TRUNC);
		FUNCTIONS.put("LENGTH", Builtin.LEN);
		FUNCTIONS.put("UPCASE", Builtin.UPPER);
		FUNCTIONS.put("COPY", Builtin.COPY);
		FUNCTIONS.put("POS", Builtin.POS);
		FUNCTIONS.put("CHR", Builtin.CHR);
		FUNCTIONS.put("ORD", Builtin.ORD);
		FUNCTIONS.put("RANDOM", Builtin.RANDOM);
		FUNCTIONS.put("ODD", Builtin.ODD);
	}

	/** What an identifier stands for. */
	private static final class Symbol {
		private final String name;
		private final Value constant;
		private final int slot;
		private final boolean global;
		private final PascalType type;
		private final Routine routine;

		private Symbol(String name, Value constant, int slot, boolean global, PascalType type, Routine routine) {
			this.name = name;
			this.constant = constant;
			this.slot = slot;
			this.global = global;
			this.type = type;
			this.routine = routine;
		}

		private boolean isVariable() {
			return type != null;
		}
	}

	private final String sourceDescription;

	private TokenStream ts;
	private TupleProgram tuples;
	private List<Routine> routines;
	private List<PascalType> globalTypes;
	private List<String> globalNames;
	private Map<String, Symbol> globals;
	private Map<String, Symbol> locals;
	private Deque<Map<String, Symbol>> loopScopes;
	private Routine currentRoutine;

	/**
	 * @param sourceDescription name of the program text, reported in errors
	 */
	public PascalParser(String sourceDescription) {
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Compiles a whole program.
	 *
	 * @param source program text
	 * @return the compiled program
	 * @throws ParserException when the text is not valid TW Pascal
	 */
	public PascalProgram parse(String source) {
		ts = new TokenStream(new Lexer(LEXER_SPEC, sourceDescription).tokenize(source), sourceDescription);
		tuples = new TupleProgram();
		routines = new ArrayList<Routine>();
		globalTypes = new ArrayList<PascalType>();
		globalNames = new ArrayList<String>();
		globals = new HashMap<String, Symbol>();
		locals = null;
		loopScopes = new ArrayDeque<Map<String, Symbol>>();
		currentRoutine = null;

		tuples.setSourceLineNumber(ts.peek().getLine());
		String programName = null;
		if (ts.acceptKeyword("PROGRAM")) {
			programName = ts.expectIdentifier("a program name").getText();
			if (ts.acceptSymbol("(")) {
				while (!ts.acceptSymbol(")")) {
					if (ts.atEnd()) {
						throw ts.error("Expected ')' but found " + ts.peek());
					}
					ts.next();
				}
			}
			ts.expectSymbol(";");
		}
		if (ts.acceptKeyword("USES")) {
			do {
				ts.expectIdentifier("a unit name");
			} while (ts.acceptSymbol(","));
			ts.expectSymbol(";");
		}

		Address main = tuples.createAddress("main");
		tuples.gotoAddress(main);
		declarations(true);
		tuples.address(main);
		compound();
		ts.expectSymbol(".");
		if (!ts.atEnd()) {
			throw ts.error("Unexpected " + ts.peek() + " after the end of the program");
		}
		tuples.postProcess();
		return new PascalProgram(sourceDescription, programName, tuples, routines, globalTypes, globalNames);
	}

	// declarations

	private void declarations(boolean global) {
		while (true) {
			if (ts.acceptKeyword("CONST")) {
				constSection();
			} else if (ts.acceptKeyword("VAR")) {
				varSection();
			} else if (global && ts.isKeyword("PROCEDURE")) {
				routine(false);
			} else if (global && ts.isKeyword("FUNCTION")) {
				routine(true);
			} else if (ts.isKeyword("TYPE")) {
				throw ts.error("Type declarations are not supported");
			} else if (!global && (ts.isKeyword("PROCEDURE") || ts.isKeyword("FUNCTION"))) {
				throw ts.error("Nested routines are not supported");
			} else {
				return;
			}
		}
	}

	private void constSection() {
		while (isIdentifier()) {
			Token name = ts.next();
			ts.expectSymbol("=");
			Value value = constantValue();
			ts.expectSymbol(";");
			declare(name, new Symbol(name.getText(), value, -1, false, null, null));
		}
	}

	private boolean isIdentifier() {
		return ts.peek().getType() == TokenType.WORD && !ts.peek().isKeyword();
	}

	private Value constantValue() {
		boolean negative = ts.acceptSymbol("-");
		Token t = ts.next();
		Value value;
		if (t.getType() == TokenType.NUMBER) {
			value = Value.number(Double.parseDouble(t.getText()));
		} else if (t.getType() == TokenType.STRING && !negative) {
			return Value.text(t.getText());
		} else if ((t.isKeyword("TRUE") || t.isKeyword("FALSE")) && !negative) {
			return Value.bool(t.isKeyword("TRUE"));
		} else if (t.getType() == TokenType.WORD && lookup(t.getNormalized()) != null
				&& lookup(t.getNormalized()).constant != null) {
			value = lookup(t.getNormalized()).constant;
		} else {
			throw ts.error(t, "Expected a constant but found " + t);
		}
		if (negative) {
			if (!value.isNumber()) {
				throw ts.error(t, "Expected a numeric constant");
			}
			return Value.number(-value.asNumber());
		}
		return value;
	}

	private int integerConstant() {
		Token at = ts.peek();
		Value value = constantValue();
		if (!value.isNumber() || !Value.isIntegral(value.asNumber())) {
			throw ts.error(at, "Expected an integer constant");
		}
		return (int) value.asNumber();
	}

	private void varSection() {
		while (isIdentifier()) {
			List<Token> names = new ArrayList<Token>();
			do {
				names.add(ts.expectIdentifier("a variable name"));
			} while (ts.acceptSymbol(","));
			ts.expectSymbol(":");
			PascalType type = type();
			ts.expectSymbol(";");
			for (Token name : names) {
				declare(name, allocate(name.getText(), type));
			}
		}
	}

	private PascalType type() {
		if (ts.acceptKeyword("ARRAY")) {
			ts.expectSymbol("[");
			Token at = ts.peek();
			if (integerConstant() != 0) {
				throw ts.error(at, "Array lower bound must be 0");
			}
			ts.expectSymbol("..");
			at = ts.peek();
			int upper = integerConstant();
			if (upper < 0) {
				throw ts.error(at, "Array upper bound must not be negative");
			}
			ts.expectSymbol("]");
			ts.expectKeyword("OF");
			return PascalType.arrayOf(type(), upper);
		}
		Token t = ts.expectIdentifier("a type");
		String name = t.getNormalized();
		if ("INTEGER".equals(name) || "LONGINT".equals(name) || "SHORTINT".equals(name) || "BYTE".equals(name)
				|| "WORD".equals(name)) {
			return PascalType.INTEGER;
		} else if ("REAL".equals(name) || "DOUBLE".equals(name) || "SINGLE".equals(name)
				|| "EXTENDED".equals(name)) {
			return PascalType.REAL;
		} else if ("STRING".equals(name)) {
			if (ts.acceptSymbol("[")) {
				integerConstant();
				ts.expectSymbol("]");
			}
			return PascalType.STRING;
		} else if ("CHAR".equals(name)) {
			return PascalType.CHAR;
		} else if ("BOOLEAN".equals(name)) {
			return PascalType.BOOLEAN;
		}
		throw ts.error(t, "Unknown type " + t.getText());
	}

	private void declare(Token name, Symbol symbol) {
		Map<String, Symbol> scope = locals != null ? locals : globals;
		if (scope.containsKey(name.getNormalized())) {
			throw ts.error(name, "Duplicate identifier " + name.getText());
		}
		scope.put(name.getNormalized(), symbol);
	}

	/**
	 * Reserves a slot in the routine being compiled, or a global slot.
	 */
	private Symbol allocate(String name, PascalType type) {
		if (currentRoutine != null) {
			int slot = currentRoutine.addSlot(name, type);
			return new Symbol(name, null, slot, false, type, null);
		}
		globalTypes.add(type);
		globalNames.add(name);
		return new Symbol(name, null, globalTypes.size() - 1, true, type, null);
	}

	private Symbol lookup(String key) {
		for (Map<String, Symbol> scope : loopScopes) {
			Symbol symbol = scope.get(key);
			if (symbol != null) {
				return symbol;
			}
		}
		if (locals != null && locals.containsKey(key)) {
			return locals.get(key);
		}
		return globals.get(key);
	}

	private void routine(boolean function) {
		ts.next();
		Token name = ts.expectIdentifier("a routine name");
		if (globals.containsKey(name.getNormalized())) {
			throw ts.error(name, "Duplicate identifier " + name.getText());
		}
		Routine routine = new Routine(name.getText(), routines.size(), tuples.createAddress(name.getText()));
		routines.add(routine);
		globals.put(name.getNormalized(), new Symbol(name.getText(), null, -1, true, null, routine));
		currentRoutine = routine;
		locals = new HashMap<String, Symbol>();

		if (ts.acceptSymbol("(")) {
			do {
				boolean byReference = ts.acceptKeyword("VAR");
				List<Token> names = new ArrayList<Token>();
				do {
					names.add(ts.expectIdentifier("a parameter name"));
				} while (ts.acceptSymbol(","));
				ts.expectSymbol(":");
				PascalType type = type();
				for (Token parameter : names) {
					int slot = routine.addParameter(parameter.getText(), type, byReference);
					declare(parameter, new Symbol(parameter.getText(), null, slot, false, type, null));
				}
			} while (ts.acceptSymbol(";"));
			ts.expectSymbol(")");
		}
		if (function) {
			ts.expectSymbol(":");
			routine.setResultType(type());
		}
		ts.expectSymbol(";");
		declarations(false);

		tuples.address(routine.getEntry());
		Token end = compound();
		tuples.setSourceLineNumber(end.getLine());
		tuples.add(Opcode.RETURN_ROUTINE);
		ts.expectSymbol(";");
		currentRoutine = null;
		locals = null;
	}

	// statements

	/**
	 * @return the closing {@code end}
	 */
	private Token compound() {
		ts.expectKeyword("BEGIN");
		statementList();
		return ts.expectKeyword("END");
	}

	private void statementList() {
		statement();
		while (ts.acceptSymbol(";")) {
			statement();
		}
	}

	private void statement() {
		Token t = ts.peek();
		tuples.setSourceLineNumber(t.getLine());
		if (t.isKeyword("BEGIN")) {
			compound();
		} else if (t.isKeyword("IF")) {
			ifStatement();
		} else if (t.isKeyword("WHILE")) {
			whileStatement();
		} else if (t.isKeyword("REPEAT")) {
			repeatStatement();
		} else if (t.isKeyword("FOR")) {
			forStatement();
		} else if (t.isKeyword("CASE")) {
			caseStatement();
		} else if (t.getType() == TokenType.WORD && !t.isKeyword()) {
			identifierStatement();
		} else if (!(t.isSymbol(";") || t.isKeyword("END") || t.isKeyword("UNTIL") || t.isKeyword("ELSE")
				|| t.isKeyword("OTHERWISE"))) {
			throw ts.error("Expected a statement but found " + t);
		}
	}

	private void identifierStatement() {
		Token name = ts.next();
		String key = name.getNormalized();
		Symbol symbol = lookup(key);
		if (symbol == null) {
			standardProcedure(name);
			return;
		}
		if (symbol.constant != null) {
			throw ts.error(name, "Cannot assign to constant " + name.getText());
		}
		if (symbol.isVariable()) {
			assignment(symbol);
			return;
		}
		Routine routine = symbol.routine;
		if (ts.isSymbol(":=")) {
			if (routine != currentRoutine || !routine.isFunction()) {
				throw ts.error(name, "Cannot assign to " + name.getText() + " here");
			}
			ts.next();
			expression();
			tuples.add(Opcode.STORE_RESULT);
			return;
		}
		call(routine, name);
		if (routine.isFunction()) {
			tuples.add(Opcode.POP);
		}
	}

	private void assignment(Symbol symbol) {
		if (ts.isSymbol("[")) {
			if (!symbol.type.isArray()) {
				throw ts.error(symbol.name + " is not an array");
			}
			ts.next();
			expression();
			ts.expectSymbol("]");
			ts.expectSymbol(":=");
			expression();
			tuples.add(Opcode.STORE_INDEXED, symbol.slot, symbol.global);
		} else {
			ts.expectSymbol(":=");
			expression();
			tuples.add(Opcode.STORE_SLOT, symbol.slot, symbol.global);
		}
	}

	private void standardProcedure(Token name) {
		String key = name.getNormalized();
		if ("WRITE".equals(key) || "WRITELN".equals(key)) {
			write("WRITELN".equals(key));
		} else if ("READ".equals(key) || "READLN".equals(key)) {
			read("READLN".equals(key));
		} else if ("INC".equals(key) || "DEC".equals(key)) {
			increment("INC".equals(key));
		} else if ("HALT".equals(key)) {
			if (ts.acceptSymbol("(")) {
				expression();
				ts.expectSymbol(")");
				tuples.add(Opcode.POP);
			}
			tuples.add(Opcode.HALT);
		} else if ("CLRSCR".equals(key)) {
			tuples.add(Opcode.CLEAR_SCREEN);
		} else {
			throw ts.error(name, "Unknown identifier " + name.getText());
		}
	}

	private void write(boolean lineEnd) {
		List<Integer> formats = new ArrayList<Integer>();
		if (ts.acceptSymbol("(")) {
			if (!ts.isSymbol(")")) {
				do {
					expression();
					int format = 0;
					if (ts.acceptSymbol(":")) {
						expression();
						format++;
						if (ts.acceptSymbol(":")) {
							expression();
							format++;
						}
					}
					formats.add(format);
				} while (ts.acceptSymbol(","));
			}
			ts.expectSymbol(")");
		}
		int[] itemFormats = new int[formats.size()];
		for (int i = 0; i < itemFormats.length; i++) {
			itemFormats[i] = formats.get(i);
		}
		tuples.add(Opcode.WRITE, itemFormats, lineEnd);
	}

	private void read(boolean line) {
		int count = 0;
		if (ts.acceptSymbol("(")) {
			if (!ts.isSymbol(")")) {
				do {
					reference();
					tuples.add(Opcode.READ, true);
					count++;
				} while (ts.acceptSymbol(","));
			}
			ts.expectSymbol(")");
		}
		if (count == 0 && line) {
			tuples.add(Opcode.READ, false);
		}
	}

	/**
	 * Compiles {@code inc(v[, n])} and {@code dec(v[, n])} as a load, an
	 * addition and a store.
	 */
	private void increment(boolean up) {
		ts.expectSymbol("(");
		Token name = ts.expectIdentifier("a variable");
		Symbol symbol = variable(name);
		Symbol index = null;
		if (ts.acceptSymbol("[")) {
			if (!symbol.type.isArray()) {
				throw ts.error(name, name.getText() + " is not an array");
			}
			index = allocate("index", PascalType.ANY);
			expression();
			ts.expectSymbol("]");
			tuples.add(Opcode.STORE_SLOT, index.slot, index.global);
			tuples.add(Opcode.LOAD_SLOT, index.slot, index.global);
			tuples.add(Opcode.LOAD_SLOT, index.slot, index.global);
			tuples.add(Opcode.LOAD_INDEXED, symbol.slot, symbol.global);
		} else {
			tuples.add(Opcode.LOAD_SLOT, symbol.slot, symbol.global);
		}
		if (ts.acceptSymbol(",")) {
			expression();
		} else {
			tuples.push(Value.ONE);
		}
		ts.expectSymbol(")");
		tuples.add(up ? Opcode.ADD : Opcode.SUBTRACT);
		tuples.add(index != null ? Opcode.STORE_INDEXED : Opcode.STORE_SLOT, symbol.slot, symbol.global);
	}

	private Symbol variable(Token name) {
		Symbol symbol = lookup(name.getNormalized());
		if (symbol == null) {
			throw ts.error(name, "Unknown identifier " + name.getText());
		}
		if (!symbol.isVariable()) {
			throw ts.error(name, name.getText() + " is not a variable");
		}
		return symbol;
	}

	/**
	 * A variable or an array element passed by reference.
	 */
	private void reference() {
		Token name = ts.expectIdentifier("a variable");
		Symbol symbol = variable(name);
		if (ts.acceptSymbol("[")) {
			if (!symbol.type.isArray()) {
				throw ts.error(name, name.getText() + " is not an array");
			}
			expression();
			ts.expectSymbol("]");
			tuples.add(Opcode.PUSH_ELEMENT_REF, symbol.slot, symbol.global);
		} else {
			tuples.add(Opcode.PUSH_REF, symbol.slot, symbol.global);
		}
	}

	private void call(Routine routine, Token name) {
		List<Routine.Parameter> parameters = routine.getParameters();
		int count = 0;
		if (ts.acceptSymbol("(")) {
			if (!ts.isSymbol(")")) {
				do {
					if (count >= parameters.size()) {
						throw ts.error("Too many arguments for " + routine.getName());
					}
					if (parameters.get(count).isByReference()) {
						if (!isIdentifier() || lookup(ts.peek().getNormalized()) == null
								|| !lookup(ts.peek().getNormalized()).isVariable()) {
							throw ts.error("Argument " + (count + 1) + " of " + routine.getName() + " must be a variable");
						}
						reference();
					} else {
						expression();
					}
					count++;
				} while (ts.acceptSymbol(","));
			}
			ts.expectSymbol(")");
		}
		if (count != parameters.size()) {
			throw ts.error(name, routine.getName() + " expects " + parameters.size() + " argument(s)");
		}
		tuples.add(Opcode.CALL, routine.getIndex());
	}

	private void ifStatement() {
		ts.next();
		expression();
		ts.expectKeyword("THEN");
		Address elseBranch = tuples.createAddress("else");
		tuples.ifFalse(elseBranch);
		statement();
		if (ts.acceptKeyword("ELSE")) {
			Address end = tuples.createAddress("endif");
			tuples.gotoAddress(end);
			tuples.address(elseBranch);
			statement();
			tuples.address(end);
		} else {
			tuples.address(elseBranch);
		}
	}

	private void whileStatement() {
		ts.next();
		Address start = tuples.createAddress("while");
		Address end = tuples.createAddress("endwhile");
		tuples.address(start);
		expression();
		ts.expectKeyword("DO");
		tuples.ifFalse(end);
		statement();
		tuples.gotoAddress(start);
		tuples.address(end);
	}

	private void repeatStatement() {
		ts.next();
		Address start = tuples.createAddress("repeat");
		tuples.address(start);
		statementList();
		Token until = ts.expectKeyword("UNTIL");
		tuples.setSourceLineNumber(until.getLine());
		expression();
		tuples.ifFalse(start);
	}

	private void forStatement() {
		ts.next();
		Token name = ts.expectIdentifier("a loop variable");
		Symbol control = lookup(name.getNormalized());
		Map<String, Symbol> loopScope = null;
		if (control == null) {
			control = allocate(name.getText(), PascalType.INTEGER);
			loopScope = new HashMap<String, Symbol>();
			loopScope.put(name.getNormalized(), control);
		} else if (!control.isVariable() || control.type.isArray()) {
			throw ts.error(name, name.getText() + " cannot be a loop variable");
		}
		ts.expectSymbol(":=");
		expression();
		tuples.add(Opcode.STORE_SLOT, control.slot, control.global);
		boolean down = ts.acceptKeyword("DOWNTO");
		if (!down) {
			ts.expectKeyword("TO");
		}
		expression();
		Symbol limit = allocate("limit", PascalType.ANY);
		tuples.add(Opcode.STORE_SLOT, limit.slot, limit.global);
		ts.expectKeyword("DO");

		Address loop = tuples.createAddress("for");
		Address exit = tuples.createAddress("endfor");
		tuples.address(loop);
		tuples.add(Opcode.LOAD_SLOT, control.slot, control.global);
		tuples.add(Opcode.LOAD_SLOT, limit.slot, limit.global);
		tuples.add(down ? Opcode.CMP_LT : Opcode.CMP_GT);
		tuples.ifTrue(exit);
		if (loopScope != null) {
			loopScopes.push(loopScope);
		}
		statement();
		if (loopScope != null) {
			loopScopes.pop();
		}
		tuples.add(Opcode.LOAD_SLOT, control.slot, control.global);
		tuples.push(Value.ONE);
		tuples.add(down ? Opcode.SUBTRACT : Opcode.ADD);
		tuples.add(Opcode.STORE_SLOT, control.slot, control.global);
		tuples.gotoAddress(loop);
		tuples.address(exit);
	}

	private void caseStatement() {
		ts.next();
		expression();
		Symbol selector = allocate("selector", PascalType.ANY);
		tuples.add(Opcode.STORE_SLOT, selector.slot, selector.global);
		ts.expectKeyword("OF");
		Address end = tuples.createAddress("endcase");
		while (!ts.isKeyword("END") && !ts.isKeyword("ELSE") && !ts.isKeyword("OTHERWISE")) {
			Address body = tuples.createAddress("case");
			Address nextArm = tuples.createAddress("nextcase");
			do {
				caseLabel(selector);
				tuples.ifTrue(body);
			} while (ts.acceptSymbol(","));
			ts.expectSymbol(":");
			tuples.gotoAddress(nextArm);
			tuples.address(body);
			statement();
			tuples.gotoAddress(end);
			tuples.address(nextArm);
			if (!ts.acceptSymbol(";")) {
				break;
			}
		}
		if (ts.acceptKeyword("ELSE") || ts.acceptKeyword("OTHERWISE")) {
			statementList();
		}
		ts.expectKeyword("END");
		tuples.address(end);
	}

	/**
	 * Pushes whether the selector matches one label: a constant, or a range
	 * {@code low..high}.
	 */
	private void caseLabel(Symbol selector) {
		Value low = constantValue();
		tuples.add(Opcode.LOAD_SLOT, selector.slot, selector.global);
		tuples.push(low);
		if (ts.acceptSymbol("..")) {
			Value high = constantValue();
			tuples.add(Opcode.CMP_GE);
			tuples.add(Opcode.LOAD_SLOT, selector.slot, selector.global);
			tuples.push(high);
			tuples.add(Opcode.CMP_LE);
			tuples.add(Opcode.AND);
		} else {
			tuples.add(Opcode.CMP_EQ);
		}
	}

	// expressions

	private void expression() {
		simpleExpression();
		Opcode relation = relation(ts.peek());
		if (relation != null) {
			ts.next();
			simpleExpression();
			tuples.add(relation);
		}
	}

	private static Opcode relation(Token t) {
		if (t.getType() != TokenType.SYMBOL) {
			return null;
		}
		String s = t.getText();
		if ("=".equals(s)) {
			return Opcode.CMP_EQ;
		} else if ("<>".equals(s)) {
			return Opcode.CMP_NE;
		} else if ("<".equals(s)) {
			return Opcode.CMP_LT;
		} else if ("<=".equals(s)) {
			return Opcode.CMP_LE;
		} else if (">".equals(s)) {
			return Opcode.CMP_GT;
		} else if (">=".equals(s)) {
			return Opcode.CMP_GE;
		}
		return null;
	}

	private void simpleExpression() {
		boolean negate = ts.acceptSymbol("-");
		if (!negate) {
			ts.acceptSymbol("+");
		}
		term();
		if (negate) {
			tuples.add(Opcode.NEGATE);
		}
		while (true) {
			if (ts.acceptSymbol("+")) {
				term();
				tuples.add(Opcode.ADD);
			} else if (ts.acceptSymbol("-")) {
				term();
				tuples.add(Opcode.SUBTRACT);
			} else if (ts.acceptKeyword("OR")) {
				term();
				tuples.add(Opcode.OR);
			} else {
				return;
			}
		}
	}

	private void term() {
		factor();
		while (true) {
			if (ts.acceptSymbol("*")) {
				factor();
				tuples.add(Opcode.MULTIPLY);
			} else if (ts.acceptSymbol("/")) {
				factor();
				tuples.add(Opcode.DIVIDE);
			} else if (ts.acceptKeyword("DIV")) {
				factor();
				tuples.add(Opcode.INT_DIVIDE);
			} else if (ts.acceptKeyword("MOD")) {
				factor();
				tuples.add(Opcode.MODULO);
			} else if (ts.acceptKeyword("AND")) {
				factor();
				tuples.add(Opcode.AND);
			} else {
				return;
			}
		}
	}

	private void factor() {
		Token t = ts.peek();
		if (t.getType() == TokenType.NUMBER) {
			ts.next();
			tuples.push(Value.number(Double.parseDouble(t.getText())));
		} else if (t.getType() == TokenType.STRING) {
			ts.next();
			tuples.push(Value.text(t.getText()));
		} else if (ts.acceptSymbol("(")) {
			expression();
			ts.expectSymbol(")");
		} else if (ts.acceptKeyword("NOT")) {
			factor();
			tuples.add(Opcode.NOT);
		} else if (ts.acceptSymbol("-")) {
			factor();
			tuples.add(Opcode.NEGATE);
		} else if (t.isKeyword("TRUE") || t.isKeyword("FALSE")) {
			ts.next();
			tuples.push(Value.bool(t.isKeyword("TRUE")));
		} else if (t.getType() == TokenType.WORD && !t.isKeyword()) {
			ts.next();
			identifierFactor(t);
		} else {
			throw ts.error("Expected an expression but found " + t);
		}
	}

	private void identifierFactor(Token name) {
		Symbol symbol = lookup(name.getNormalized());
		if (symbol == null) {
			Builtin function = FUNCTIONS.get(name.getNormalized());
			if (function == null) {
				throw ts.error(name, "Unknown identifier " + name.getText());
			}
			functionCall(function, name);
		} else if (symbol.constant != null) {
			tuples.push(symbol.constant);
		} else if (symbol.isVariable()) {
			if (ts.acceptSymbol("[")) {
				if (!symbol.type.isArray() && symbol.type != PascalType.STRING) {
					throw ts.error(name, name.getText() + " cannot be indexed");
				}
				expression();
				ts.expectSymbol("]");
				tuples.add(Opcode.LOAD_INDEXED, symbol.slot, symbol.global);
			} else {
				tuples.add(Opcode.LOAD_SLOT, symbol.slot, symbol.global);
			}
		} else {
			if (!symbol.routine.isFunction()) {
				throw ts.error(name, "Procedure " + name.getText() + " has no value");
			}
			call(symbol.routine, name);
		}
	}

	private void functionCall(Builtin function, Token name) {
		int count = 0;
		if (ts.acceptSymbol("(")) {
			if (!ts.isSymbol(")")) {
				do {
					expression();
					count++;
				} while (ts.acceptSymbol(","));
			}
			ts.expectSymbol(")");
		}
		if (!function.acceptsArgCount(count)) {
			throw ts.error(name, "Wrong number of arguments for " + name.getText());
		}
		tuples.add(Opcode.CALL_BUILTIN, function, count);
	}
}
