package com.querybreakdown.parser;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.calcite.config.Lex;
import org.junit.jupiter.api.Test;

class CalciteQueryParserTest {
    private final CalciteQueryParser parser = new CalciteQueryParser();

    @Test
    void testValidQueryParses() {
        assertDoesNotThrow(() -> parser.parse("SELECT a FROM b"));
        assertDoesNotThrow(() -> parser.parse("SELECT a,\n  b\nFROM t\nWHERE c = 1"));
    }

    @Test
    void testDuplicatedKeywordIsLocated() {
        SqlSyntaxException exception = assertThrows(SqlSyntaxException.class,
            () -> parser.parse("SELECT * FROM t WHERE WHERE x = 1"));

        assertTrue(exception.isLocatable());
        assertEquals(1, exception.getStartLine());
        assertEquals(23, exception.getStartColumn());
        assertFalse(exception.getExpectedTokens().isEmpty());
    }

    @Test
    void testTruncatedQueryIsEndOfInput() {
        SqlSyntaxException exception = assertThrows(SqlSyntaxException.class,
            () -> parser.parse("SELECT a FROM b WHERE"));

        assertFalse(exception.isLocatable());
    }

    @Test
    void testResolveLex() {
        assertEquals(Lex.BIG_QUERY, CalciteQueryParser.resolveLex(null));
        assertEquals(Lex.MYSQL, CalciteQueryParser.resolveLex(" mysql "));
        assertThrows(IllegalArgumentException.class, () -> CalciteQueryParser.resolveLex("NOT_A_LEX"));
        assertThrows(IllegalArgumentException.class, () -> new CalciteQueryParser("NOT_A_LEX"));
    }
}
