package com.querybreakdown.result;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybreakdown.search.EditType;
import java.util.List;
import org.junit.jupiter.api.Test;

class BreakdownResultTest {

    @Test
    void testParseableResult() {
        BreakdownResult result = BreakdownResult.parseable("SELECT 1", 1, 3);

        assertTrue(result.isParseable());
        assertEquals(0, result.depth());
        assertEquals("SELECT 1", result.repairedQuery());
        assertEquals(100.0, result.parseablePercentage());
    }

    @Test
    void testParseablePercentage() {
        EditDescriptor replacement = new EditDescriptor(new ErrorPosition(1, 10, 1, 13), EditType.REPLACEMENT,
            "FORM", "FROM", 4);
        BreakdownResult result = new BreakdownResult("SELECT a FORM b xxxx", "SELECT a FROM b xxxx",
            List.of(replacement), false, false, 4, 1);

        assertFalse(result.isParseable());
        assertEquals(4, result.unparseableCharacters());
        assertEquals(80.0, result.parseablePercentage(), 1e-9);
    }

    @Test
    void testShiftMovesFirstLineColumnsOnly() {
        ErrorPosition position = new ErrorPosition(1, 5, 2, 3);

        assertEquals(new ErrorPosition(3, 9, 4, 3), position.shift(2, 4));
        assertEquals(new ErrorPosition(4, 2, 4, 6), new ErrorPosition(2, 2, 2, 6).shift(2, 4));
    }

    @Test
    void testJsonUsesEditorFieldNames() throws Exception {
        EditDescriptor deletion = new EditDescriptor(new ErrorPosition(1, 1, 1, 4), EditType.DELETION, null, null, 4);
        EditDescriptor replacement = new EditDescriptor(new ErrorPosition(1, 5, 1, 8), EditType.REPLACEMENT,
            "WITH", "BY", 4);

        String json = new ObjectMapper().writeValueAsString(List.of(deletion, replacement));

        assertEquals("[{\"error_position\":{\"startLine\":1,\"startColumn\":1,\"endLine\":1,\"endColumn\":4},"
            + "\"error_type\":\"DELETION\"},"
            + "{\"error_position\":{\"startLine\":1,\"startColumn\":5,\"endLine\":1,\"endColumn\":8},"
            + "\"error_type\":\"REPLACEMENT\",\"replacedFrom\":\"WITH\",\"replacedTo\":\"BY\"}]", json);
    }
}
