package org.metricshub.timewarp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.regex.Pattern;
import org.junit.Test;

public class LexerTest {

	private static final LexerSpec PASCAL_LIKE = LexerSpec
			.builder("test")
			.caseSensitive(false)
			.keywords("BEGIN", "END")
			.operators(":=", "..", ":", ";", ".", "+")
			.blockComment("{", "}")
			.quote('\'', TokenType.QUOTED, LexerSpec.EscapeStyle.DOUBLED_QUOTE)
			.build();

	private static final LexerSpec BASIC_LIKE = LexerSpec
			.builder("test")
			.caseSensitive(false)
			.keywords("PRINT")
			.lineCommentKeyword("REM")
			.operators("=", "+")
			.identifierSuffixes("$")
			.quote('"', TokenType.STRING, LexerSpec.EscapeStyle.NONE)
			.newlinesSignificant(true)
			.lineNumbers(true)
			.rawLinePattern(Pattern.compile("T:"))
			.build();

	private static List<Token> tokenize(LexerSpec spec, String text) {
		return new Lexer(spec, "test").tokenize(text);
	}

	@Test
	public void testWordsAreNormalizedAndPositioned() {
		List<Token> tokens = tokenize(PASCAL_LIKE, "begin\n  x := x + 1\nEnd.");
		assertEquals(9, tokens.size());
		Token begin = tokens.get(0);
		assertTrue(begin.isKeyword("BEGIN"));
		assertEquals("begin", begin.getText());
		assertEquals(1, begin.getLine());
		assertEquals(1, begin.getColumn());

		Token x = tokens.get(1);
		assertEquals(TokenType.WORD, x.getType());
		assertFalse(x.isKeyword());
		assertEquals("X", x.getNormalized());
		assertEquals(2, x.getLine());
		assertEquals(3, x.getColumn());

		assertTrue(tokens.get(2).isSymbol(":="));
		assertEquals(TokenType.NUMBER, tokens.get(5).getType());
		assertTrue(tokens.get(6).isKeyword("END"));
		assertTrue(tokens.get(7).isSymbol("."));
		assertEquals(TokenType.EOF, tokens.get(8).getType());
	}

	@Test
	public void testRangeIsNotADecimalPoint() {
		List<Token> tokens = tokenize(PASCAL_LIKE, "1..9 2.5");
		assertEquals("1", tokens.get(0).getText());
		assertTrue(tokens.get(1).isSymbol(".."));
		assertEquals("9", tokens.get(2).getText());
		assertEquals("2.5", tokens.get(3).getText());
	}

	@Test
	public void testBlockCommentsKeepLineCount() {
		List<Token> tokens = tokenize(PASCAL_LIKE, "{ one\n two }\nx");
		assertEquals(3, tokens.get(0).getLine());
	}

	@Test
	public void testDoubledQuote() {
		List<Token> tokens = tokenize(PASCAL_LIKE, "'it''s'");
		assertEquals(TokenType.QUOTED, tokens.get(0).getType());
		assertEquals("it's", tokens.get(0).getText());
	}

	@Test
	public void testUnterminatedString() {
		try {
			tokenize(PASCAL_LIKE, "x := 'abc\n");
			fail("Unterminated string accepted");
		} catch (LexerException e) {
			assertEquals("Unterminated string", e.getReason());
			assertEquals(1, e.getLine());
			assertEquals(6, e.getColumn());
		}
	}

	@Test
	public void testUnterminatedComment() {
		try {
			tokenize(PASCAL_LIKE, "begin\n{ never closed");
			fail("Unterminated comment accepted");
		} catch (LexerException e) {
			assertEquals("Unterminated comment", e.getReason());
			assertEquals(2, e.getLine());
		}
	}

	@Test
	public void testUnexpectedCharacter() {
		try {
			tokenize(PASCAL_LIKE, "x := #");
			fail("Unknown character accepted");
		} catch (LexerException e) {
			assertEquals("Unexpected character '#'", e.getReason());
			assertEquals(6, e.getColumn());
		}
	}

	@Test
	public void testLineStructure() {
		List<Token> tokens = tokenize(BASIC_LIKE, "10 a$ = \"x\" REM note\n20 T: Hello\n");
		assertEquals("10", tokens.get(0).getText());
		assertEquals("A$", tokens.get(1).getNormalized());
		assertTrue(tokens.get(2).isSymbol("="));
		assertEquals(TokenType.STRING, tokens.get(3).getType());
		assertEquals(TokenType.NEWLINE, tokens.get(4).getType());
		assertEquals("20", tokens.get(5).getText());
		Token raw = tokens.get(6);
		assertEquals(TokenType.RAW, raw.getType());
		assertEquals("T: Hello", raw.getText());
		assertEquals(4, raw.getColumn());
	}
}
