package org.metricshub.timewarp.frontend.basic;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.timewarp.frontend.Lexer;
import org.metricshub.timewarp.frontend.LexerException;
import org.metricshub.timewarp.frontend.LexerSpec;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.frontend.Token;
import org.metricshub.timewarp.frontend.TokenStream;
import org.metricshub.timewarp.frontend.TokenType;
import org.metricshub.timewarp.intermediate.Address;
import org.metricshub.timewarp.intermediate.Builtin;
import org.metricshub.timewarp.intermediate.Opcode;
import org.metricshub.timewarp.intermediate.TupleProgram;
import org.metricshub.timewarp.jrt.TurtleCommand;
import org.metricshub.timewarp.jrt.Value;

/**
 * Compiles TW BASIC (BASIC with PILOT and Logo commands) into instruction
 * tuples.
 * <p>
 * The source is first split into logical lines. A line starting with a
 * number is a numbered line; numbered lines run in number order and a
 * repeated number replaces the earlier line. Lines without a number stay
 * right after the line that precedes them in the text. A line only ends
 * once every {@code [} of a {@code REPEAT} is closed.
 * <p>
 * PILOT lines ({@code T:}, {@code A:}, ... and {@code *labels}) are kept
 * as raw text by the lexer and parsed here.
 */
public class BasicParser {

	/** Start of a PILOT line: command letter, optional condition, colon; or a label. */
	private static final Pattern PILOT_LINE = Pattern
			.compile("(?i)(?:[TAMYNJUECRD][YN]?(?:\\([^)\\n]*\\))?[ \\t]*:|\\*[A-Za-z_])");

	private static final Pattern PILOT_COMMAND = Pattern.compile("(?s)([A-Za-z])([YyNn])?(?:\\(([^)]*)\\))?\\s*:(.*)");

	private static final Pattern PILOT_LABEL = Pattern.compile("(?s)\\*([A-Za-z_]\\w*)(.*)");

	private static final Pattern ACCEPT_LINE = Pattern.compile("(?i)A[ \\t]*:.*");

	private static final Pattern NAME = Pattern.compile("[A-Za-z_]\\w*\\$?");

	private static final String[] KEYWORDS = {
			"PRINT", "LET", "INPUT", "GOTO", "GOSUB", "RETURN", "IF", "THEN", "ELSE", "FOR", "TO", "STEP", "NEXT",
			"WHILE", "WEND", "DIM", "END", "STOP", "CLS", "AND", "OR", "NOT", "MOD", "REPEAT", "TRUE", "FALSE",
			"FORWARD", "FD", "BACK", "BK", "RIGHT", "RT", "LEFT", "LT", "PENUP", "PU", "PENDOWN", "PD", "HOME",
			"SETXY", "SETHEADING", "SETH", "SETCOLOR", "SETPENCOLOR", "SETPENSIZE", "CIRCLE", "CLEARSCREEN", "CS",
			"HIDETURTLE", "HT", "SHOWTURTLE", "ST" };

	static final LexerSpec LEXER_SPEC = baseSpec("TW BASIC")
			.lineNumbers(true)
			.rawLinePattern(PILOT_LINE)
			.build();

	/** Used for the expressions and assignments embedded in PILOT lines. */
	private static final LexerSpec EMBEDDED_SPEC = baseSpec("TW BASIC").build();

	private static final Map<String, TurtleCommand.Op> LOGO_COMMANDS = new HashMap<String, TurtleCommand.Op>();
	private static final Map<String, Builtin> FUNCTIONS = new HashMap<String, Builtin>();

	static {
		logo(TurtleCommand.Op.FORWARD, "FORWARD", "FD");
		logo(TurtleCommand.Op.BACK, "BACK", "BK");
		logo(TurtleCommand.Op.RIGHT, "RIGHT", "RT");
		logo(TurtleCommand.Op.LEFT, "LEFT", "LT");
		logo(TurtleCommand.Op.PENUP, "PENUP", "PU");
		logo(TurtleCommand.Op.PENDOWN, "PENDOWN", "PD");
		logo(TurtleCommand.Op.HOME, "HOME");
		logo(TurtleCommand.Op.SETXY, "SETXY");
		logo(TurtleCommand.Op.SETHEADING, "SETHEADING", "SETH");
		logo(TurtleCommand.Op.SETCOLOR, "SETCOLOR", "SETPENCOLOR");
		logo(TurtleCommand.Op.SETPENSIZE, "SETPENSIZE");
		logo(TurtleCommand.Op.CIRCLE, "CIRCLE");
		logo(TurtleCommand.Op.CLEARSCREEN, "CLEARSCREEN", "CS");
		logo(TurtleCommand.Op.HIDETURTLE, "HIDETURTLE", "HT");
		logo(TurtleCommand.Op.SHOWTURTLE, "SHOWTURTLE", "ST");

		FUNCTIONS.put("ABS", Builtin.ABS);
		FUNCTIONS.put("INT", Builtin.INT);
		FUNCTIONS.put("SQR", Builtin.SQRT);
		FUNCTIONS.put("SQRT", Builtin.SQRT);
		FUNCTIONS.put("SIN", Builtin.SIN);
		FUNCTIONS.put("COS", Builtin.COS);
		FUNCTIONS.put("TAN", Builtin.TAN);
		FUNCTIONS.put("ATN", Builtin.ATN);
		FUNCTIONS.put("EXP", Builtin.EXP);
		FUNCTIONS.put("LOG", Builtin.LOG);
		FUNCTIONS.put("RND", Builtin.RND);
		FUNCTIONS.put("SGN", Builtin.SGN);
		FUNCTIONS.put("LEN", Builtin.LEN);
		FUNCTIONS.put("VAL", Builtin.VAL);
		FUNCTIONS.put("STR$", Builtin.STR);
		FUNCTIONS.put("CHR$", Builtin.CHR);
		FUNCTIONS.put("ASC", Builtin.ASC);
		FUNCTIONS.put("LEFT$", Builtin.LEFT);
		FUNCTIONS.put("RIGHT$", Builtin.RIGHT);
		FUNCTIONS.put("MID$", Builtin.MID);
		FUNCTIONS.put("UPPER$", Builtin.UPPER);
		FUNCTIONS.put("LOWER$", Builtin.LOWER);
	}

	private static void logo(TurtleCommand.Op op, String... names) {
		for (String name : names) {
			LOGO_COMMANDS.put(name, op);
		}
	}

	private static LexerSpec.Builder baseSpec(String name) {
		return LexerSpec
				.builder(name)
				.caseSensitive(false)
				.keywords(KEYWORDS)
				.operators("<=", ">=", "<>", "=", "<", ">", "+", "-", "*", "/", "^", "(", ")", ",", ";", ":", "[", "]", "?")
				.lineComment("'")
				.lineCommentKeyword("REM")
				.quote('"', TokenType.STRING, LexerSpec.EscapeStyle.DOUBLED_QUOTE)
				.identifierSuffixes("$")
				.newlinesSignificant(true);
	}

	/** One line of the program, with its tokens followed by an EOF token. */
	private static final class LogicalLine {
		private final Long number;
		private final int sourceLine;
		private final List<Token> tokens;

		private LogicalLine(Long number, int sourceLine, List<Token> tokens) {
			this.number = number;
			this.sourceLine = sourceLine;
			this.tokens = tokens;
		}

		private boolean isAcceptLine() {
			Token first = tokens.get(0);
			return first.getType() == TokenType.RAW && ACCEPT_LINE.matcher(first.getText()).matches();
		}
	}

	private static final class ForBlock {
		private final String variable;
		private final Address exit;
		private final Token token;

		private ForBlock(String variable, Address exit, Token token) {
			this.variable = variable;
			this.exit = exit;
			this.token = token;
		}
	}

	private static final class WhileBlock {
		private final Address start;
		private final Address end;
		private final Token token;

		private WhileBlock(Address start, Address end, Token token) {
			this.start = start;
			this.end = end;
			this.token = token;
		}
	}

	private final String sourceDescription;

	private TupleProgram tuples;
	private Map<Long, Integer> lineIndex;
	private Map<String, Integer> labelIndex;
	private Set<String> variables;
	private Deque<ForBlock> forBlocks;
	private Deque<WhileBlock> whileBlocks;
	private TokenStream ts;
	private boolean numberedLine;

	/**
	 * @param sourceDescription name of the program text, reported in errors
	 */
	public BasicParser(String sourceDescription) {
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Compiles a whole program.
	 *
	 * @param source program text
	 * @return the compiled program
	 * @throws ParserException when the text is not valid TW BASIC
	 */
	public BasicProgram parse(String source) {
		tuples = new TupleProgram();
		lineIndex = new HashMap<Long, Integer>();
		labelIndex = new HashMap<String, Integer>();
		variables = new LinkedHashSet<String>();
		forBlocks = new ArrayDeque<ForBlock>();
		whileBlocks = new ArrayDeque<WhileBlock>();

		List<Token> tokens = new Lexer(LEXER_SPEC, sourceDescription).tokenize(source);
		List<LogicalLine> lines = order(split(tokens));
		for (int i = 0; i < lines.size(); i++) {
			compileLine(lines, i);
		}
		if (!forBlocks.isEmpty()) {
			throw error(forBlocks.peek().token, "FOR without NEXT");
		}
		if (!whileBlocks.isEmpty()) {
			throw error(whileBlocks.peek().token, "WHILE without WEND");
		}
		tuples.postProcess();
		return new BasicProgram(sourceDescription, tuples, lineIndex, labelIndex, variables);
	}

	private ParserException error(Token at, String message) {
		return new ParserException(message, sourceDescription, at.getLine(), at.getColumn());
	}

	private List<LogicalLine> split(List<Token> tokens) {
		List<LogicalLine> lines = new ArrayList<LogicalLine>();
		int i = 0;
		while (tokens.get(i).getType() != TokenType.EOF) {
			Token first = tokens.get(i);
			if (first.getType() == TokenType.NEWLINE) {
				i++;
				continue;
			}
			Long number = null;
			if (first.getType() == TokenType.NUMBER) {
				number = parseLineNumber(first);
				i++;
			}
			List<Token> body = new ArrayList<Token>();
			int depth = 0;
			Token open = null;
			while (true) {
				Token t = tokens.get(i);
				if (t.getType() == TokenType.EOF) {
					break;
				}
				i++;
				if (t.getType() == TokenType.NEWLINE && depth == 0) {
					break;
				}
				if (t.isSymbol("[")) {
					if (depth == 0) {
						open = t;
					}
					depth++;
				} else if (t.isSymbol("]")) {
					depth--;
				}
				body.add(t);
			}
			if (depth > 0) {
				throw error(open, "Missing ']'");
			}
			Token last = body.isEmpty() ? first : body.get(body.size() - 1);
			body.add(new Token(TokenType.EOF, "", "", false, last.getLine(), last.getColumn() + last.getText().length()));
			lines.add(new LogicalLine(number, first.getLine(), body));
		}
		return lines;
	}

	private Long parseLineNumber(Token token) {
		try {
			long number = Long.parseLong(token.getText());
			if (number > Integer.MAX_VALUE) {
				throw error(token, "Line number too large: " + token.getText());
			}
			return number;
		} catch (NumberFormatException e) {
			throw error(token, "Invalid line number " + token.getText());
		}
	}

	/**
	 * Sorts numbered lines, each one followed by the unnumbered lines written
	 * after it. Unnumbered lines before the first numbered one come first.
	 * A repeated number replaces the numbered line only; the unnumbered lines
	 * of both copies stay in the group, in source order.
	 */
	private static List<LogicalLine> order(List<LogicalLine> lines) {
		List<LogicalLine> head = new ArrayList<LogicalLine>();
		TreeMap<Long, List<LogicalLine>> numbered = new TreeMap<Long, List<LogicalLine>>();
		List<LogicalLine> current = head;
		for (LogicalLine line : lines) {
			if (line.number != null) {
				current = numbered.get(line.number);
				if (current == null) {
					current = new ArrayList<LogicalLine>();
					current.add(line);
					numbered.put(line.number, current);
				} else {
					current.set(0, line);
				}
				continue;
			}
			current.add(line);
		}
		List<LogicalLine> ordered = new ArrayList<LogicalLine>(head);
		for (List<LogicalLine> group : numbered.values()) {
			ordered.addAll(group);
		}
		return ordered;
	}

	private void compileLine(List<LogicalLine> lines, int index) {
		LogicalLine line = lines.get(index);
		numberedLine = line.number != null;
		tuples.setSourceLineNumber(numberedLine ? line.number.intValue() : line.sourceLine);
		if (numberedLine) {
			lineIndex.put(line.number, tuples.nextIndex());
		}
		ts = new TokenStream(line.tokens, sourceDescription);
		if (ts.peek().getType() == TokenType.RAW) {
			boolean promptFollows = index + 1 < lines.size() && lines.get(index + 1).isAcceptLine();
			pilot(ts.next(), promptFollows);
		} else {
			statements(false);
		}
		if (!ts.atEnd()) {
			throw ts.error("Unexpected " + ts.peek());
		}
	}

	private boolean atStatementEnd() {
		Token t = ts.peek();
		return t.getType() == TokenType.EOF
				|| t.getType() == TokenType.NEWLINE
				|| t.isSymbol(":")
				|| t.isSymbol("]")
				|| t.isKeyword("ELSE");
	}

	/**
	 * Statements up to the end of the line, or up to the closing bracket of a
	 * {@code REPEAT} block where line breaks separate statements too.
	 */
	private void statements(boolean inBrackets) {
		while (true) {
			while (ts.isSymbol(":") || ts.peek().getType() == TokenType.NEWLINE) {
				ts.next();
			}
			if (ts.atEnd() || ts.isSymbol("]")) {
				return;
			}
			statement();
			if (!inBrackets && !atStatementEnd()) {
				throw ts.error("Expected end of statement but found " + ts.peek());
			}
		}
	}

	private void statement() {
		Token t = ts.peek();
		if (!numberedLine) {
			tuples.setSourceLineNumber(t.getLine());
		}
		if (t.isSymbol("?")) {
			ts.next();
			print();
			return;
		}
		if (t.getType() != TokenType.WORD) {
			throw ts.error("Expected a statement but found " + t);
		}
		if (!t.isKeyword()) {
			Token after = ts.peek(1);
			if (!after.isSymbol("=") && !after.isSymbol("(")) {
				throw ts.error("Unknown statement " + t.getText());
			}
			assignment();
			return;
		}
		String word = t.getNormalized();
		if ("PRINT".equals(word)) {
			ts.next();
			print();
		} else if ("LET".equals(word)) {
			ts.next();
			assignment();
		} else if ("INPUT".equals(word)) {
			input();
		} else if ("GOTO".equals(word)) {
			jump(false);
		} else if ("GOSUB".equals(word)) {
			jump(true);
		} else if ("RETURN".equals(word)) {
			ts.next();
			tuples.add(Opcode.RETURN);
		} else if ("IF".equals(word)) {
			ifStatement();
		} else if ("FOR".equals(word)) {
			forStatement();
		} else if ("NEXT".equals(word)) {
			nextStatement();
		} else if ("WHILE".equals(word)) {
			whileStatement();
		} else if ("WEND".equals(word)) {
			wendStatement();
		} else if ("DIM".equals(word)) {
			ts.next();
			dimensions();
		} else if ("END".equals(word) || "STOP".equals(word)) {
			ts.next();
			tuples.add(Opcode.HALT);
		} else if ("CLS".equals(word)) {
			ts.next();
			tuples.add(Opcode.CLEAR_SCREEN);
		} else if ("REPEAT".equals(word)) {
			repeat();
		} else if (LOGO_COMMANDS.containsKey(word)) {
			turtle(LOGO_COMMANDS.get(word));
		} else {
			throw ts.error("Unexpected " + t.getText());
		}
	}

	private String variableName() {
		Token t = ts.peek();
		if (t.getType() != TokenType.WORD) {
			throw ts.error("Expected a variable but found " + t);
		}
		if (t.isKeyword() || FUNCTIONS.containsKey(t.getNormalized())) {
			throw ts.error(t.getText() + " cannot be used as a variable name");
		}
		ts.next();
		variables.add(t.getNormalized());
		return t.getNormalized();
	}

	private void assignment() {
		String name = variableName();
		if (ts.acceptSymbol("(")) {
			expression();
			ts.expectSymbol(")");
			ts.expectSymbol("=");
			expression();
			tuples.add(Opcode.STORE_ELEMENT, name);
		} else {
			ts.expectSymbol("=");
			expression();
			tuples.add(Opcode.STORE_VAR, name);
		}
	}

	private void print() {
		StringBuilder separators = new StringBuilder();
		boolean lineEnd = true;
		while (!atStatementEnd()) {
			if (ts.isSymbol(";") || ts.isSymbol(",")) {
				tuples.push(Value.EMPTY_TEXT);
			} else {
				expression();
			}
			if (ts.acceptSymbol(";")) {
				separators.append(';');
				lineEnd = false;
			} else if (ts.acceptSymbol(",")) {
				separators.append(',');
				lineEnd = false;
			} else {
				separators.append(' ');
				lineEnd = true;
			}
		}
		tuples.add(Opcode.PRINT, separators.toString(), lineEnd);
	}

	private void input() {
		ts.next();
		String prompt = null;
		if (ts.peek().getType() == TokenType.STRING) {
			prompt = ts.next().getText();
			if (!ts.acceptSymbol(";")) {
				ts.expectSymbol(",");
			}
		}
		do {
			String name = variableName();
			if (ts.isSymbol("(")) {
				throw ts.error("INPUT only accepts simple variables");
			}
			tuples.add(Opcode.INPUT, name, prompt);
			prompt = null;
		} while (ts.acceptSymbol(","));
	}

	private void jump(boolean gosub) {
		ts.next();
		if (ts.acceptSymbol("*")) {
			tuples.add(gosub ? Opcode.GOSUB_LABEL : Opcode.GOTO_LABEL, labelName());
		} else {
			expression();
			tuples.add(gosub ? Opcode.GOSUB_LINE : Opcode.GOTO_LINE);
		}
	}

	private String labelName() {
		Token t = ts.next();
		if (t.getType() != TokenType.WORD) {
			throw error(t, "Expected a label name but found " + t);
		}
		return t.getNormalized();
	}

	private void ifStatement() {
		ts.next();
		expression();
		Address elseBranch = tuples.createAddress("else");
		tuples.ifFalse(elseBranch);
		if (ts.acceptKeyword("THEN")) {
			branch();
		} else if (ts.isKeyword("GOTO")) {
			jump(false);
		} else {
			throw ts.error("Expected THEN but found " + ts.peek());
		}
		if (ts.acceptKeyword("ELSE")) {
			Address end = tuples.createAddress("endif");
			tuples.gotoAddress(end);
			tuples.address(elseBranch);
			branch();
			tuples.address(end);
		} else {
			tuples.address(elseBranch);
		}
	}

	/**
	 * A line number to jump to, or the statements up to {@code ELSE} or the
	 * end of the line.
	 */
	private void branch() {
		if (ts.peek().getType() == TokenType.NUMBER) {
			tuples.push(Value.number(Double.parseDouble(ts.next().getText())));
			tuples.add(Opcode.GOTO_LINE);
			return;
		}
		statement();
		while (ts.isSymbol(":")) {
			ts.next();
			Token t = ts.peek();
			if (t.getType() == TokenType.EOF
					|| t.getType() == TokenType.NEWLINE
					|| t.isSymbol("]")
					|| t.isKeyword("ELSE")) {
				return;
			}
			statement();
		}
	}

	private void forStatement() {
		Token forToken = ts.next();
		String name = variableName();
		if (BasicProgram.isTextVariable(name)) {
			throw error(forToken, "FOR needs a numeric variable");
		}
		ts.expectSymbol("=");
		expression();
		ts.expectKeyword("TO");
		expression();
		if (ts.acceptKeyword("STEP")) {
			expression();
		} else {
			tuples.push(Value.ONE);
		}
		Address exit = tuples.createAddress("next_" + name);
		tuples.addJump(Opcode.FOR_INIT, exit, name);
		forBlocks.push(new ForBlock(name, exit, forToken));
	}

	private void nextStatement() {
		ts.next();
		if (atStatementEnd()) {
			tuples.add(Opcode.FOR_NEXT, (Object) null);
			closeFor(null);
			return;
		}
		do {
			String name = variableName();
			tuples.add(Opcode.FOR_NEXT, name);
			closeFor(name);
		} while (ts.acceptSymbol(","));
	}

	/**
	 * Resolves the exit address of the loop a {@code NEXT} closes, and of the
	 * loops nested in it that were left open. A {@code NEXT} matching no
	 * loop is left to fail at run time.
	 */
	private void closeFor(String name) {
		if (forBlocks.isEmpty()) {
			return;
		}
		if (name != null) {
			boolean open = false;
			for (ForBlock block : forBlocks) {
				if (block.variable.equals(name)) {
					open = true;
					break;
				}
			}
			if (!open) {
				return;
			}
		}
		while (true) {
			ForBlock block = forBlocks.pop();
			tuples.address(block.exit);
			if (name == null || block.variable.equals(name)) {
				return;
			}
		}
	}

	private void whileStatement() {
		Token whileToken = ts.next();
		Address start = tuples.createAddress("while");
		Address end = tuples.createAddress("wend");
		tuples.address(start);
		expression();
		tuples.ifFalse(end);
		whileBlocks.push(new WhileBlock(start, end, whileToken));
	}

	private void wendStatement() {
		Token wend = ts.next();
		if (whileBlocks.isEmpty()) {
			throw error(wend, "WEND without WHILE");
		}
		WhileBlock block = whileBlocks.pop();
		tuples.gotoAddress(block.start);
		tuples.address(block.end);
	}

	private void dimensions() {
		do {
			String name = variableName();
			ts.expectSymbol("(");
			expression();
			ts.expectSymbol(")");
			tuples.add(Opcode.DIM, name);
		} while (ts.acceptSymbol(","));
	}

	private void repeat() {
		ts.next();
		expression();
		Address body = tuples.createAddress("repeat");
		Address exit = tuples.createAddress("repeat_end");
		tuples.addJump(Opcode.REPEAT_INIT, exit);
		tuples.address(body);
		ts.expectSymbol("[");
		statements(true);
		ts.expectSymbol("]");
		tuples.addJump(Opcode.REPEAT_NEXT, body);
		tuples.address(exit);
	}

	private void turtle(TurtleCommand.Op op) {
		ts.next();
		if (op == TurtleCommand.Op.SETCOLOR && isColorName()) {
			tuples.push(Value.text(ts.next().getText().toLowerCase(Locale.ROOT)));
		} else {
			for (int i = 0; i < op.arity(); i++) {
				if (i > 0) {
					ts.acceptSymbol(",");
				}
				expression();
			}
		}
		tuples.add(Opcode.TURTLE, op);
	}

	/**
	 * {@code SETCOLOR red}: a bare word that is not a variable of the program
	 * names a color.
	 */
	private boolean isColorName() {
		Token t = ts.peek();
		if (t.getType() != TokenType.WORD || t.isKeyword() || variables.contains(t.getNormalized())) {
			return false;
		}
		Token after = ts.peek(1);
		return after.getType() == TokenType.EOF
				|| after.getType() == TokenType.NEWLINE
				|| after.isSymbol(":")
				|| after.isSymbol("]")
				|| after.getType() == TokenType.WORD;
	}

	// expressions, lowest precedence first

	private void expression() {
		andExpression();
		while (ts.acceptKeyword("OR")) {
			andExpression();
			tuples.add(Opcode.OR);
		}
	}

	private void andExpression() {
		notExpression();
		while (ts.acceptKeyword("AND")) {
			notExpression();
			tuples.add(Opcode.AND);
		}
	}

	private void notExpression() {
		if (ts.acceptKeyword("NOT")) {
			notExpression();
			tuples.add(Opcode.NOT);
		} else {
			comparison();
		}
	}

	private void comparison() {
		additive();
		Opcode opcode = comparisonOpcode(ts.peek());
		if (opcode != null) {
			ts.next();
			additive();
			tuples.add(opcode);
		}
	}

	private static Opcode comparisonOpcode(Token t) {
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

	private void additive() {
		term();
		while (true) {
			if (ts.acceptSymbol("+")) {
				term();
				tuples.add(Opcode.ADD);
			} else if (ts.acceptSymbol("-")) {
				term();
				tuples.add(Opcode.SUBTRACT);
			} else {
				return;
			}
		}
	}

	private void term() {
		unary();
		while (true) {
			if (ts.acceptSymbol("*")) {
				unary();
				tuples.add(Opcode.MULTIPLY);
			} else if (ts.acceptSymbol("/")) {
				unary();
				tuples.add(Opcode.DIVIDE);
			} else if (ts.acceptKeyword("MOD")) {
				unary();
				tuples.add(Opcode.MODULO);
			} else {
				return;
			}
		}
	}

	private void unary() {
		if (ts.acceptSymbol("-")) {
			unary();
			tuples.add(Opcode.NEGATE);
		} else if (ts.acceptSymbol("+")) {
			unary();
		} else {
			power();
		}
	}

	private void power() {
		primary();
		if (ts.acceptSymbol("^")) {
			unary();
			tuples.add(Opcode.POWER);
		}
	}

	private void primary() {
		Token t = ts.peek();
		switch (t.getType()) {
		case NUMBER:
			ts.next();
			tuples.push(Value.number(Double.parseDouble(t.getText())));
			return;
		case STRING:
			ts.next();
			tuples.push(Value.text(t.getText()));
			return;
		case SYMBOL:
			if (ts.acceptSymbol("(")) {
				expression();
				ts.expectSymbol(")");
				return;
			}
			break;
		case WORD:
			if (t.isKeyword("TRUE") || t.isKeyword("FALSE")) {
				ts.next();
				tuples.push(Value.bool(t.isKeyword("TRUE")));
				return;
			}
			Builtin function = FUNCTIONS.get(t.getNormalized());
			if (function != null) {
				functionCall(function);
				return;
			}
			if (!t.isKeyword()) {
				String name = variableName();
				if (ts.acceptSymbol("(")) {
					expression();
					ts.expectSymbol(")");
					tuples.add(Opcode.LOAD_ELEMENT, name);
				} else {
					tuples.add(Opcode.LOAD_VAR, name);
				}
				return;
			}
			break;
		default:
			break;
		}
		throw ts.error("Expected an expression but found " + t);
	}

	private void functionCall(Builtin function) {
		Token name = ts.next();
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
			throw error(name, "Wrong number of arguments for " + name.getText());
		}
		tuples.add(Opcode.CALL_BUILTIN, function, count);
	}

	// PILOT

	private void pilot(Token raw, boolean promptFollows) {
		String text = raw.getText();
		Matcher label = PILOT_LABEL.matcher(text);
		if (label.matches()) {
			String name = label.group(1).toUpperCase(Locale.ROOT);
			if (labelIndex.containsKey(name)) {
				throw error(raw, "Duplicate label *" + name);
			}
			labelIndex.put(name, tuples.nextIndex());
			String rest = label.group(2);
			if (!rest.trim().isEmpty()) {
				embedded(raw, label.start(2), rest, false);
			}
			return;
		}
		Matcher command = PILOT_COMMAND.matcher(text);
		if (!command.matches()) {
			throw error(raw, "Malformed PILOT command");
		}
		char letter = Character.toUpperCase(command.group(1).charAt(0));
		String flag = command.group(2);
		String condition = command.group(3);
		String operand = command.group(4).trim();

		Address skip = null;
		if (flag != null) {
			skip = tuples.createAddress("pilot_skip");
			matchCondition(Character.toUpperCase(flag.charAt(0)) == 'Y', skip);
		}
		if (condition != null) {
			if (skip == null) {
				skip = tuples.createAddress("pilot_skip");
			}
			embedded(raw, command.start(3), condition, true);
			tuples.ifFalse(skip);
		}
		switch (letter) {
		case 'T':
			tuples.add(Opcode.TYPE, operand, promptFollows && skip == null);
			break;
		case 'Y':
		case 'N':
			if (skip == null) {
				skip = tuples.createAddress("pilot_skip");
			}
			matchCondition(letter == 'Y', skip);
			tuples.add(Opcode.TYPE, operand, false);
			break;
		case 'A':
			tuples.add(Opcode.ACCEPT, acceptTarget(raw, operand));
			break;
		case 'M':
			tuples.add(Opcode.MATCH, operand);
			break;
		case 'J':
			tuples.add(Opcode.GOTO_LABEL, pilotLabel(raw, operand));
			break;
		case 'U':
			tuples.add(Opcode.GOSUB_LABEL, pilotLabel(raw, operand));
			break;
		case 'E':
			tuples.add(Opcode.PILOT_END);
			break;
		case 'C':
			embedded(raw, command.start(4), command.group(4), false);
			break;
		case 'D':
			TokenStream saved = ts;
			ts = embeddedStream(raw, command.start(4), command.group(4));
			dimensions();
			expectEmbeddedEnd();
			ts = saved;
			break;
		case 'R':
			break;
		default:
			throw error(raw, "Unknown PILOT command " + letter + ":");
		}
		if (skip != null) {
			tuples.address(skip);
		}
	}

	private void matchCondition(boolean whenMatched, Address skip) {
		tuples.add(Opcode.PUSH_MATCH);
		if (!whenMatched) {
			tuples.add(Opcode.NOT);
		}
		tuples.ifFalse(skip);
	}

	/**
	 * {@code A:} stores the answer in {@code NAME}, {@code NAME$},
	 * {@code #NAME} (numeric) or {@code $NAME} (text), or only in the answer
	 * buffer when no variable is given.
	 */
	private String acceptTarget(Token raw, String operand) {
		if (operand.isEmpty()) {
			return null;
		}
		String name = operand;
		if (name.startsWith("#")) {
			name = name.substring(1);
		} else if (name.startsWith("$")) {
			name = name.substring(1) + "$";
		}
		if (!NAME.matcher(name).matches()) {
			throw error(raw, "Invalid A: variable " + operand);
		}
		name = name.toUpperCase(Locale.ROOT);
		variables.add(name);
		return name;
	}

	private String pilotLabel(Token raw, String operand) {
		String name = operand.startsWith("*") ? operand.substring(1) : operand;
		if (!NAME.matcher(name).matches() || name.endsWith("$")) {
			throw error(raw, "Invalid label " + operand);
		}
		return name.toUpperCase(Locale.ROOT);
	}

	/**
	 * Compiles a piece of BASIC embedded in a PILOT line: an expression, or
	 * statements.
	 */
	private void embedded(Token raw, int offset, String text, boolean expressionOnly) {
		TokenStream saved = ts;
		ts = embeddedStream(raw, offset, text);
		if (expressionOnly) {
			expression();
		} else {
			statements(false);
		}
		expectEmbeddedEnd();
		ts = saved;
	}

	private void expectEmbeddedEnd() {
		if (!ts.atEnd()) {
			throw ts.error("Unexpected " + ts.peek());
		}
	}

	private TokenStream embeddedStream(Token raw, int offset, String text) {
		int column = raw.getColumn() + offset;
		List<Token> tokens;
		try {
			tokens = new Lexer(EMBEDDED_SPEC, sourceDescription).tokenize(text);
		} catch (LexerException e) {
			throw new LexerException(e.getReason(), sourceDescription, raw.getLine(), column + e.getColumn() - 1);
		}
		List<Token> located = new ArrayList<Token>();
		for (Token t : tokens) {
			if (t.getType() != TokenType.NEWLINE) {
				located.add(new Token(
						t.getType(),
						t.getText(),
						t.getNormalized(),
						t.isKeyword(),
						raw.getLine(),
						column + t.getColumn() - 1));
			}
		}
		return new TokenStream(located, sourceDescription);
	}
}
