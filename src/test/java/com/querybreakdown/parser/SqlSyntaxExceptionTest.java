package com.querybreakdown.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SqlSyntaxExceptionTest {

    @Test
    void testLocatableSyntaxError() {
        SqlSyntaxException exception = error(1, 10, 1, 13, "Encountered \"FORM\" at line 1, column 10.");

        assertTrue(exception.isLocatable());
        assertEquals(1, exception.getStartLine());
        assertEquals(10, exception.getStartColumn());
        assertEquals(1, exception.getEndLine());
        assertEquals(13, exception.getEndColumn());
        assertEquals(List.of("\"FROM\"", "<IDENTIFIER>"), exception.expectedTokenList());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "ParseException: Encountered \"<EOF>\" at line 1, column 21.",
        "TokenMgrError: Lexical error at line 1, column 9.  Encountered: <EOF> after : \"'abc\"",
        "org.apache.calcite.sql.validate.SqlValidatorException: Column 'x' not found"
    })
    void testEndOfInputAndValidationErrorsAreNotLocatable(String cause) {
        assertFalse(error(1, 5, 1, 9, cause).isLocatable());
    }

    @Test
    void testZeroPositionIsNotLocatable() {
        assertFalse(error(0, 0, 0, 0, "Encountered \"x\"").isLocatable());
        assertFalse(error(1, 0, 1, 0, "Encountered \"x\"").isLocatable());
        assertFalse(error(0, 3, 0, 3, "Encountered \"x\"").isLocatable());
    }

    @Test
    void testNullCollectionsDefaultToEmpty() {
        SqlSyntaxException exception = new SqlSyntaxException("broken", 1, 1, 1, 1, null, null);

        assertTrue(exception.getExpectedTokens().isEmpty());
        assertEquals("", exception.getCauseText());
        assertTrue(exception.isLocatable());
    }

    private static SqlSyntaxException error(int startLine, int startColumn, int endLine, int endColumn, String cause) {
        Set<String> expected = new LinkedHashSet<>(List.of("\"FROM\"", "<IDENTIFIER>"));
        return new SqlSyntaxException("syntax error", startLine, startColumn, endLine, endColumn, expected, cause);
    }
}
