package com.kbdash.formula.grammar;

import com.kbdash.formula.FormulaSyntaxException;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaLexerTest {

    private MutableList<TokenType> types(String input) {
        return new FormulaLexer(input).tokenize().collect(Token::type);
    }

    @Test
    public void testCallWithComparison() {
        assertEquals(
                List.of(TokenType.WORD, TokenType.LPAREN, TokenType.RPAREN, TokenType.GTE, TokenType.NUMBER, TokenType.EOF),
                types("count() >= 100"));
    }

    @Test
    public void testTwoCharacterOperators() {
        assertEquals(
                List.of(TokenType.LTE, TokenType.EQ_EQ, TokenType.EQUALS, TokenType.GT, TokenType.LT, TokenType.EOF),
                types("<= == = > <"));
    }

    @Test
    public void testFieldNamesKeepDotsAndDashes() {
        MutableList<Token> tokens = new FormulaLexer("max(in-bytes.total)").tokenize();
        assertEquals(TokenType.WORD, tokens.get(2).type());
        assertEquals("in-bytes.total", tokens.get(2).text());
        assertEquals(4, tokens.get(2).start());
        assertEquals(18, tokens.get(2).end());
    }

    @Test
    public void testMinusBetweenCallsIsAnOperator() {
        assertEquals(
                List.of(TokenType.RPAREN, TokenType.MINUS, TokenType.WORD, TokenType.EOF),
                types(")-sum"));
    }

    @Test
    public void testNumberForms() {
        MutableList<Token> tokens = new FormulaLexer("42 3.14 1e3 2.5E-2").tokenize();
        assertEquals("42", tokens.get(0).text());
        assertEquals("3.14", tokens.get(1).text());
        assertEquals("1e3", tokens.get(2).text());
        assertEquals("2.5E-2", tokens.get(3).text());
        assertTrue(tokens.take(4).allSatisfy(token -> token.type() == TokenType.NUMBER));
    }

    @Test
    public void testNumberFollowedByLettersSplits() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.WORD, TokenType.EOF), types("5m"));
    }

    @Test
    public void testSingleAndDoubleQuotedStrings() {
        MutableList<Token> tokens = new FormulaLexer("'status:200' \"a 'b'\"").tokenize();
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("status:200", tokens.get(0).unquoted());
        assertEquals("\"a 'b'\"", tokens.get(1).text());
        assertEquals("a 'b'", tokens.get(1).unquoted());
    }

    @Test
    public void testEofPositionedAtEnd() {
        MutableList<Token> tokens = new FormulaLexer("  count  ").tokenize();
        assertEquals(TokenType.EOF, tokens.getLast().type());
        assertEquals(9, tokens.getLast().start());
    }

    @Test
    public void testUnterminatedString() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> new FormulaLexer("count(kql='status:200)").tokenize());
        assertEquals(10, e.position());
        assertEquals("Unterminated string", e.reason());
    }

    @Test
    public void testUnexpectedCharacter() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> new FormulaLexer("count() % 2").tokenize());
        assertEquals(8, e.position());
        assertTrue(e.getMessage().contains("'%'"));
    }
}
