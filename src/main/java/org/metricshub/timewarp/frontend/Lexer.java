package org.metricshub.timewarp.frontend;

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
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Table-driven tokenizer shared by the three languages. What differs from
 * one language to another is described by a {@link LexerSpec}; the
 * scanning loop itself is the same.
 */
public class Lexer {

	private final LexerSpec spec;
	private final String sourceDescription;

	private String source;
	private int pos;
	private int line;
	private int lineStartPos;
	private boolean atLineStart;
	private List<Token> tokens;

	/**
	 * @param spec token table of the language
	 * @param sourceDescription name reported in errors
	 */
	public Lexer(LexerSpec spec, String sourceDescription) {
		this.spec = spec;
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Splits {@code text} into tokens. The list always ends with an
	 * {@link TokenType#EOF} token.
	 *
	 * @param text program text
	 * @return the tokens
	 * @throws LexerException on malformed input
	 */
	public List<Token> tokenize(String text) {
		source = text;
		pos = 0;
		line = 1;
		lineStartPos = 0;
		atLineStart = true;
		tokens = new ArrayList<Token>();

		while (true) {
			if (atLineStart) {
				atLineStart = false;
				if (lexLineStart()) {
					continue;
				}
			}
			skipBlanksAndComments();
			if (pos >= source.length()) {
				break;
			}
			char c = source.charAt(pos);
			if (c == '\n') {
				if (spec.isNewlinesSignificant()) {
					add(TokenType.NEWLINE, "\n", "\n", false, pos);
				}
				newLine();
				continue;
			}
			if (Character.isDigit(c)) {
				readNumber();
			} else if (Character.isLetter(c) || c == '_') {
				readWord();
			} else if (spec.quoteType(c) != null) {
				readQuoted(c);
			} else {
				readOperator();
			}
		}
		tokens.add(new Token(TokenType.EOF, "", "", false, line, column(pos)));
		return tokens;
	}

	/**
	 * Handles the line number and the raw-line pattern at the start of a line.
	 *
	 * @return {@code true} when the whole line was consumed as a raw token
	 */
	private boolean lexLineStart() {
		if (spec.getRawLinePattern() == null) {
			return false;
		}
		skipBlanks();
		if (spec.isLineNumbers() && pos < source.length() && Character.isDigit(source.charAt(pos))) {
			readNumber();
			skipBlanks();
		}
		int eol = source.indexOf('\n', pos);
		if (eol < 0) {
			eol = source.length();
		}
		Matcher matcher = spec.getRawLinePattern().matcher(source);
		matcher.region(pos, eol);
		if (!matcher.lookingAt()) {
			return false;
		}
		String raw = source.substring(pos, eol);
		if (raw.endsWith("\r")) {
			raw = raw.substring(0, raw.length() - 1);
		}
		add(TokenType.RAW, raw, raw, false, pos);
		pos = eol;
		return true;
	}

	private void newLine() {
		pos++;
		line++;
		lineStartPos = pos;
		atLineStart = true;
	}

	private void skipBlanks() {
		while (pos < source.length()) {
			char c = source.charAt(pos);
			if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
				pos++;
			} else {
				break;
			}
		}
	}

	/**
	 * Skip all whitespaces and comments. Line ends are only skipped when the
	 * language does not care about them.
	 */
	private void skipBlanksAndComments() {
		while (pos < source.length()) {
			skipBlanks();
			if (pos >= source.length()) {
				return;
			}
			char c = source.charAt(pos);
			if (c == '\n' && !spec.isNewlinesSignificant()) {
				newLine();
				continue;
			}
			if (skipLineComment() || skipBlockComment()) {
				continue;
			}
			return;
		}
	}

	private boolean skipLineComment() {
		for (String prefix : spec.getLineCommentPrefixes()) {
			if (source.startsWith(prefix, pos)) {
				skipToEndOfLine();
				return true;
			}
		}
		return false;
	}

	private void skipToEndOfLine() {
		while (pos < source.length() && source.charAt(pos) != '\n') {
			pos++;
		}
	}

	private boolean skipBlockComment() {
		for (Map.Entry<String, String> comment : spec.getBlockComments().entrySet()) {
			if (source.startsWith(comment.getKey(), pos)) {
				int startLine = line;
				int startColumn = column(pos);
				pos += comment.getKey().length();
				while (!source.startsWith(comment.getValue(), pos)) {
					if (pos >= source.length()) {
						throw new LexerException("Unterminated comment", sourceDescription, startLine, startColumn);
					}
					if (source.charAt(pos) == '\n') {
						line++;
						lineStartPos = pos + 1;
					}
					pos++;
				}
				pos += comment.getValue().length();
				return true;
			}
		}
		return false;
	}

	private void readNumber() {
		int start = pos;
		while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
			pos++;
		}
		// a dot is part of the number only when a digit follows: "1..9", "X = 3."
		if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
			pos++;
			while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
				pos++;
			}
		}
		if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
			int exp = pos + 1;
			if (exp < source.length() && (source.charAt(exp) == '+' || source.charAt(exp) == '-')) {
				exp++;
			}
			if (exp < source.length() && Character.isDigit(source.charAt(exp))) {
				pos = exp;
				while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
					pos++;
				}
			}
		}
		String text = source.substring(start, pos);
		add(TokenType.NUMBER, text, text, false, start);
	}

	private void readWord() {
		int start = pos;
		while (pos < source.length()
				&& (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
			pos++;
		}
		if (pos < source.length() && spec.isIdentifierSuffix(source.charAt(pos))) {
			pos++;
		}
		String text = source.substring(start, pos);
		String normalized = spec.normalize(text);
		if (spec.isLineCommentKeyword(normalized)) {
			skipToEndOfLine();
			return;
		}
		add(TokenType.WORD, text, normalized, spec.isKeyword(normalized), start);
	}

	private void readQuoted(char quote) {
		int start = pos;
		int startLine = line;
		LexerSpec.EscapeStyle style = spec.escapeStyle(quote);
		StringBuilder sb = new StringBuilder();
		pos++;
		while (true) {
			if (pos >= source.length() || source.charAt(pos) == '\n') {
				throw new LexerException("Unterminated string", sourceDescription, startLine, column(start));
			}
			char c = source.charAt(pos);
			if (c == quote) {
				if (style != LexerSpec.EscapeStyle.NONE && pos + 1 < source.length()
						&& source.charAt(pos + 1) == quote) {
					sb.append(quote);
					pos += 2;
					continue;
				}
				pos++;
				break;
			}
			if (c == '\\' && style == LexerSpec.EscapeStyle.BACKSLASH && pos + 1 < source.length()) {
				sb.append(unescape(source.charAt(pos + 1)));
				pos += 2;
				continue;
			}
			sb.append(c);
			pos++;
		}
		String text = sb.toString();
		add(spec.quoteType(quote), text, text, false, start);
	}

	private static char unescape(char c) {
		switch (c) {
		case 'n':
			return '\n';
		case 't':
			return '\t';
		case 'r':
			return '\r';
		case 'a':
			return '\007';
		case 'b':
			return '\b';
		case 'f':
			return '\f';
		case 'v':
			return '\013';
		case '0':
			return '\0';
		default:
			return c;
		}
	}

	private void readOperator() {
		for (String op : spec.getOperators()) {
			if (source.startsWith(op, pos)) {
				add(TokenType.SYMBOL, op, op, false, pos);
				pos += op.length();
				return;
			}
		}
		throw new LexerException(
				"Unexpected character '" + source.charAt(pos) + "'",
				sourceDescription,
				line,
				column(pos));
	}

	private void add(TokenType type, String text, String normalized, boolean keyword, int at) {
		tokens.add(new Token(type, text, normalized, keyword, line, column(at)));
	}

	private int column(int at) {
		return at - lineStartPos + 1;
	}
}
