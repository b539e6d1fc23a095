package com.querybreakdown.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.querybreakdown.config.BreakdownConfig;
import com.querybreakdown.io.QueryStatement;
import com.querybreakdown.result.BreakdownResult;
import com.querybreakdown.result.EditDescriptor;
import com.querybreakdown.result.ErrorPosition;
import com.querybreakdown.search.EditType;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testMissingInputFileOptionIsUsageError() {
        int exitCode = new CommandLine(new MainCommand()).execute("-f", "json");
        assertEquals(2, exitCode);
    }

    @Test
    void testUnreadableInputReturnsOne() {
        int exitCode = new CommandLine(new MainCommand()).execute("-i", tempDir.resolve("missing.sql").toString());
        assertEquals(1, exitCode);
    }

    @Test
    void testUnknownLexReturnsOne() throws Exception {
        Path input = tempDir.resolve("input.sql");
        Files.writeString(input, "SELECT a FROM b");

        int exitCode = new CommandLine(new MainCommand()).execute("-i", input.toString(), "--lex", "NOPE");
        assertEquals(1, exitCode);
    }

    @Test
    void testJsonOutputForParseableQuery() throws Exception {
        Path input = tempDir.resolve("input.sql");
        Path output = tempDir.resolve("output.json");
        Files.writeString(input, "SELECT a FROM b;");

        int exitCode = new CommandLine(new MainCommand())
            .execute("-i", input.toString(), "-o", output.toString(), "-f", "json");

        assertEquals(0, exitCode);
        assertEquals("[ ]", Files.readString(output).trim());
    }

    @Test
    void testTextOutputReportsDeletion() throws Exception {
        Path input = tempDir.resolve("input.sql");
        Path output = tempDir.resolve("output.txt");
        Files.writeString(input, "SELECT 1;\nSELECT * FROM t WHERE WHERE x = 1");

        int exitCode = new CommandLine(new MainCommand())
            .execute("-i", input.toString(), "-o", output.toString(), "-t", "10000");

        assertEquals(0, exitCode);
        String text = Files.readString(output);
        assertTrue(text.contains("查询可直接解析"));
        assertTrue(text.contains("删除 [2:23 - 2:27]"));
    }

    @Test
    void testResolveConfigAppliesOverrides() throws Exception {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{\"timeLimitMillis\": 2000, \"replacementLimit\": 5}");

        MainCommand command = new MainCommand();
        setField(command, "configFile", configFile);
        setField(command, "replacementLimit", 2);
        setField(command, "seed", 3L);
        BreakdownConfig config = command.resolveConfig();

        assertEquals(2000L, config.getTimeLimitMillis());
        assertEquals(2, config.getReplacementLimit());
        assertEquals(3L, config.getSeed());
    }

    @Test
    void testPrintTextResultWithoutStatements() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        MainCommand.printTextResult(new PrintStream(buffer, true, StandardCharsets.UTF_8), List.of());

        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("输入中没有查询"));
    }

    @Test
    void testPrintJsonResultUsesFileCoordinates() throws Exception {
        QueryStatement statement = new QueryStatement("SELECT a FORM b", 3, 5);
        EditDescriptor edit = new EditDescriptor(new ErrorPosition(1, 10, 1, 13), EditType.REPLACEMENT,
            "FORM", "FROM", 4);
        BreakdownResult result = new BreakdownResult(statement.text(), "SELECT a FROM b", List.of(edit),
            false, false, 3, 1);
        MainCommand.StatementResult statementResult = new MainCommand.StatementResult(statement, result,
            List.of(edit.shift(statement.lineOffset(), statement.firstLineColumnOffset())));

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        MainCommand.printJsonResult(new PrintStream(buffer, true, StandardCharsets.UTF_8), List.of(statementResult));

        String json = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"error_type\" : \"REPLACEMENT\""));
        assertTrue(json.contains("\"startLine\" : 3"));
        assertTrue(json.contains("\"startColumn\" : 14"));
        assertFalse(json.contains("cost"));
    }

    @Test
    void testDescribe() {
        EditDescriptor deletion = new EditDescriptor(new ErrorPosition(1, 2, 1, 4), EditType.DELETION, null, null, 3);
        EditDescriptor replacement = new EditDescriptor(new ErrorPosition(2, 1, 2, 4), EditType.REPLACEMENT,
            "FORM", "FROM", 4);

        assertEquals("删除 [1:2 - 1:4]", MainCommand.describe(deletion));
        assertEquals("替换 [2:1 - 2:4] FORM -> FROM", MainCommand.describe(replacement));
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
