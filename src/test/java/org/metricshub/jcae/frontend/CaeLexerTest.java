package org.metricshub.jcae.frontend;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jcae.util.ScriptSource;

public class CaeLexerTest {

	private static CaeLexer lexer(String text) throws IOException {
		return new CaeLexer(new ScriptSource("test", new StringReader(text)));
	}

	private static List<Token> tokens(String text) throws IOException {
		CaeLexer lexer = lexer(text);
		List<Token> result = new ArrayList<Token>();
		Token token;
		do {
			token = lexer.lexer();
			result.add(token);
		} while (token != Token.EOF);
		return result;
	}

	@Test
	public void testRegionDeclaration() throws Exception {
		CaeLexer lexer = lexer("region main[10];");
		assertEquals(Token.KW_REGION, lexer.lexer());
		assertEquals(Token.IDENTIFIER, lexer.lexer());
		assertEquals("main", lexer.getText());
		assertEquals(Token.OPEN_BRACKET, lexer.lexer());
		assertEquals(Token.INTEGER, lexer.lexer());
		assertEquals("10", lexer.getText());
		assertEquals(Token.CLOSE_BRACKET, lexer.lexer());
		assertEquals(Token.SEMICOLON, lexer.lexer());
		assertEquals(Token.EOF, lexer.lexer());
	}

	@Test
	public void testInstructionAlphabet() throws Exception {
		assertEquals(
				Arrays
						.asList(
								Token.PLUS,
								Token.MINUS,
								Token.GT,
								Token.LT,
								Token.DOT,
								Token.COMMA,
								Token.OPEN_BRACKET,
								Token.CLOSE_BRACKET,
								Token.TILDE,
								Token.CARET,
								Token.DOLLAR,
								Token.AMPERSAND,
								Token.IDENTIFIER,
								Token.OPEN_PAREN,
								Token.CLOSE_PAREN,
								Token.AT,
								Token.IDENTIFIER,
								Token.COLON,
								Token.EOF),
				tokens("+-><.,[]~^$&r()@io:"));
	}

	@Test
	public void testHexLiteral() throws Exception {
		CaeLexer lexer = lexer("\"4a \"FF\"00>");
		assertEquals(Token.HEX_LITERAL, lexer.lexer());
		assertEquals(0x4A, lexer.getLiteral());
		assertEquals(Token.HEX_LITERAL, lexer.lexer());
		assertEquals(255, lexer.getLiteral());
		assertEquals(Token.HEX_LITERAL, lexer.lexer());
		assertEquals(0, lexer.getLiteral());
		assertEquals(Token.GT, lexer.lexer());
		assertEquals(-1, lexer.getLiteral());
	}

	@Test
	public void testMalformedHexLiteral() throws Exception {
		assertThrows("one digit then EOF", LexerException.class, () -> tokens("\"4"));
		assertThrows("one digit then punctuation", LexerException.class, () -> tokens("\"4;"));
		assertThrows("non-hex digit", LexerException.class, () -> tokens("\"4g"));
		assertThrows("space inside literal", LexerException.class, () -> tokens("\" 41"));
		assertThrows("identifier character after literal", LexerException.class, () -> tokens("\"414"));
		assertThrows("identifier character after literal", LexerException.class, () -> tokens("\"41foo"));
	}

	@Test
	public void testInvalidCharacterPosition() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> tokens("proc main:\n  +!;"));
		assertEquals("test", e.getSourceDescription());
		assertEquals(2, e.getLineNumber());
		assertEquals(4, e.getColumn());
	}

	@Test
	public void testIdentifiersAndIntegers() throws Exception {
		CaeLexer lexer = lexer("42 x2 2x read_digit proc regions");
		assertEquals(Token.INTEGER, lexer.lexer());
		assertEquals(Token.IDENTIFIER, lexer.lexer());
		assertEquals(Token.IDENTIFIER, lexer.lexer());
		assertEquals("2x", lexer.getText());
		assertEquals(Token.IDENTIFIER, lexer.lexer());
		assertEquals("read_digit", lexer.getText());
		assertEquals(Token.KW_PROC, lexer.lexer());
		assertEquals(Token.IDENTIFIER, lexer.lexer());
		assertEquals("regions", lexer.getText());
	}

	@Test
	public void testCommentsAndPositions() throws Exception {
		CaeLexer lexer = lexer("# a comment ^&\n\r\n  +  # trailing\n\t-");
		assertEquals(Token.PLUS, lexer.lexer());
		assertEquals(3, lexer.getTokenLineNumber());
		assertEquals(3, lexer.getTokenColumn());
		assertEquals(Token.MINUS, lexer.lexer());
		assertEquals(4, lexer.getTokenLineNumber());
		assertEquals(2, lexer.getTokenColumn());
		assertEquals(Token.EOF, lexer.lexer());
	}

	@Test
	public void testLineEndings() throws Exception {
		CaeLexer lexer = lexer("+\r\n-\r.\r\r,\r");
		assertEquals(Token.PLUS, lexer.lexer());
		assertEquals(1, lexer.getTokenLineNumber());
		assertEquals(Token.MINUS, lexer.lexer());
		assertEquals(2, lexer.getTokenLineNumber());
		assertEquals(1, lexer.getTokenColumn());
		assertEquals(Token.DOT, lexer.lexer());
		assertEquals(3, lexer.getTokenLineNumber());
		assertEquals(Token.COMMA, lexer.lexer());
		assertEquals(5, lexer.getTokenLineNumber());
		assertEquals(1, lexer.getTokenColumn());
		assertEquals(Token.EOF, lexer.lexer());
	}

	@Test
	public void testErrorPositionWithCarriageReturns() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> tokens("region main[1];\rproc main:\r  +!;"));
		assertEquals(3, e.getLineNumber());
		assertEquals(4, e.getColumn());
	}
}
