package com.naturaltime.plugin.arithmetic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionLexerTest {

    @Test
    void testSignNumberWordAndSpacing() {
        List<LexToken> tokens = new ExpressionLexer().tokenize("-15  years ago");

        assertEquals(5, tokens.size());
        assertLexToken(tokens.get(0), TokenType.MINUS, "-", 0, false);
        assertLexToken(tokens.get(1), TokenType.NUMBER, "15", 1, false);
        assertLexToken(tokens.get(2), TokenType.WORD, "years", 5, true);
        assertLexToken(tokens.get(3), TokenType.WORD, "ago", 11, true);
        assertLexToken(tokens.get(4), TokenType.EOF, "", 14, false);
    }

    @Test
    void testWordStopsAtDigitsAndSigns() {
        List<LexToken> tokens = new ExpressionLexer().tokenize("years15+days");

        assertLexToken(tokens.get(0), TokenType.WORD, "years", 0, false);
        assertLexToken(tokens.get(1), TokenType.NUMBER, "15", 5, false);
        assertLexToken(tokens.get(2), TokenType.PLUS, "+", 7, false);
        assertLexToken(tokens.get(3), TokenType.WORD, "days", 8, false);
    }

    @Test
    void testNonAsciiWordsAndTrailingSpace() {
        List<LexToken> tokens = new ExpressionLexer().tokenize("42 années ");

        assertLexToken(tokens.get(1), TokenType.WORD, "années", 3, true);
        assertEquals(9, tokens.get(1).end());
        assertTrue(tokens.get(2).precededBySpace());
        assertEquals(TokenType.EOF, tokens.get(2).type());
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        List<LexToken> tokens = new ExpressionLexer().tokenize("");

        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).type());
        assertFalse(tokens.get(0).precededBySpace());
    }

    @Test
    void testWordCharacterClass() {
        assertTrue(ExpressionLexer.isWordChar('a'));
        assertTrue(ExpressionLexer.isWordChar('é'));
        assertTrue(ExpressionLexer.isWordChar('.'));
        assertFalse(ExpressionLexer.isWordChar('7'));
        assertFalse(ExpressionLexer.isWordChar('-'));
        assertFalse(ExpressionLexer.isWordChar('+'));
        assertFalse(ExpressionLexer.isWordChar('\t'));
        assertFalse(ExpressionLexer.isWordChar('\u00A0'));
        assertFalse(ExpressionLexer.isWordChar('\u202F'));
    }

    @Test
    void testNoBreakSpaceSeparatesTokens() {
        List<LexToken> tokens = new ExpressionLexer().tokenize("15\u00A0years\u2007ago");

        assertEquals(4, tokens.size());
        assertLexToken(tokens.get(1), TokenType.WORD, "years", 3, true);
        assertLexToken(tokens.get(2), TokenType.WORD, "ago", 9, true);
    }

    private void assertLexToken(LexToken token, TokenType type, String value, int start, boolean precededBySpace) {
        assertEquals(type, token.type());
        assertEquals(value, token.value());
        assertEquals(start, token.start());
        assertEquals(precededBySpace, token.precededBySpace());
    }
}
