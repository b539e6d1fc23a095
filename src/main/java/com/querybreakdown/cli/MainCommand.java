package com.querybreakdown.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybreakdown.config.BreakdownConfig;
import com.querybreakdown.config.Constants;
import com.querybreakdown.io.InputReader;
import com.querybreakdown.io.QueryStatement;
import com.querybreakdown.parser.CalciteQueryParser;
import com.querybreakdown.parser.QueryParser;
import com.querybreakdown.result.BreakdownResult;
import com.querybreakdown.result.EditDescriptor;
import com.querybreakdown.result.ErrorPosition;
import com.querybreakdown.search.EditType;
import com.querybreakdown.search.QueryBreakdown;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "qbd",
    description = "🔧 定位并修复 SQL 查询中的不可解析片段",
    mixinStandardHelpOptions = true,
    version = "1.0.0"
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input-file"}, description = "包含待分析查询的文件路径", required = true)
    private Path inputFile;

    @Option(names = {"-o", "--output-file"}, description = "结果输出文件路径，未指定时输出到控制台")
    private Path outputFile;

    @Option(names = {"-t", "--time-limit"}, description = "单条查询的搜索时间上限（毫秒）")
    private Long timeLimitMillis;

    @Option(names = {"-r", "--replacement-limit"}, description = "每个错误位置尝试的替换数")
    private Integer replacementLimit;

    @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
    private String format;

    @Option(names = {"--seed"}, description = "替换候选随机抽样种子")
    private Long seed;

    @Option(names = {"--lex"}, description = "SQL 词法规则，例如 BIG_QUERY、MYSQL、ORACLE")
    private String lex;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        BreakdownConfig config;
        List<QueryStatement> statements;
        try {
            config = resolveConfig();
            statements = new InputReader().read(inputFile);
        } catch (IOException exception) {
            System.err.println("❌ 读取输入失败: " + exception.getMessage());
            return 1;
        }

        QueryParser parser;
        try {
            parser = new CalciteQueryParser(config.getLex());
        } catch (IllegalArgumentException exception) {
            System.err.println("❌ " + exception.getMessage());
            return 1;
        }

        QueryBreakdown breakdown = new QueryBreakdown(parser, config);
        try (PrintStream out = openOutput()) {
            List<StatementResult> results = analyze(statements, breakdown, config);
            if ("json".equalsIgnoreCase(format)) {
                printJsonResult(out, results);
            } else {
                printTextResult(out, results);
            }
            return 0;
        } catch (IOException exception) {
            System.err.println("❌ 写入结果失败: " + exception.getMessage());
            return 1;
        } catch (RuntimeException exception) {
            System.err.println("❌ 分析失败: " + exception.getMessage());
            exception.printStackTrace();
            return 1;
        }
    }

    BreakdownConfig resolveConfig() throws IOException {
        BreakdownConfig config = configFile == null ? BreakdownConfig.defaults() : BreakdownConfig.load(configFile);
        if (timeLimitMillis != null) {
            config.setTimeLimitMillis(timeLimitMillis);
        }
        if (replacementLimit != null) {
            config.setReplacementLimit(replacementLimit);
        }
        if (seed != null) {
            config.setSeed(seed);
        }
        if (lex != null) {
            config.setLex(lex);
        }
        return config.sanitize();
    }

    static List<StatementResult> analyze(List<QueryStatement> statements, QueryBreakdown breakdown,
                                         BreakdownConfig config) {
        List<StatementResult> results = new ArrayList<>(statements.size());
        for (QueryStatement statement : statements) {
            if (statement.text().length() > Constants.MAX_QUERY_LENGTH) {
                throw new CommandLine.ParameterException(new CommandLine(new MainCommand()),
                    "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
            }
            BreakdownResult result = breakdown.run(statement.text(), config);
            List<EditDescriptor> shifted = new ArrayList<>(result.edits().size());
            for (EditDescriptor edit : result.edits()) {
                shifted.add(edit.shift(statement.lineOffset(), statement.firstLineColumnOffset()));
            }
            results.add(new StatementResult(statement, result, List.copyOf(shifted)));
        }
        return results;
    }

    private PrintStream openOutput() throws IOException {
        if (outputFile == null) {
            return new PrintStream(new NonClosingOutputStream(System.out), true, StandardCharsets.UTF_8);
        }
        return new PrintStream(Files.newOutputStream(outputFile), true, StandardCharsets.UTF_8);
    }

    static void printTextResult(PrintStream out, List<StatementResult> results) {
        if (results.isEmpty()) {
            out.println("⚠️ 输入中没有查询");
            return;
        }

        int index = 1;
        for (StatementResult statementResult : results) {
            QueryStatement statement = statementResult.statement();
            BreakdownResult result = statementResult.result();
            out.println("─────────────────────────────────");
            out.printf("📄 语句 %d (第 %d 行, 第 %d 列)%n", index++, statement.startLine(), statement.startColumn());
            out.println("原始查询: " + statement.text());
            if (result.isParseable()) {
                out.println("✅ 查询可直接解析");
            } else {
                out.println("❌ 不可解析片段:");
                int rank = 1;
                for (EditDescriptor edit : statementResult.edits()) {
                    out.printf("   %d. %s%n", rank++, describe(edit));
                }
                out.println("🔧 修复后查询: " + result.repairedQuery());
            }
            if (result.timedOut()) {
                out.println("⏱️ 搜索超时，结果可能不是最少编辑");
            }
            out.printf("📊 可解析字符 %.2f%%，解析 %d 次，用时 %dms%n",
                result.parseablePercentage(), result.parseAttempts(), result.elapsedMs());
        }
    }

    static void printJsonResult(PrintStream out, List<StatementResult> results) throws IOException {
        List<EditDescriptor> edits = new ArrayList<>();
        for (StatementResult result : results) {
            edits.addAll(result.edits());
        }
        ObjectMapper mapper = new ObjectMapper();
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(edits));
    }

    static String describe(EditDescriptor edit) {
        ErrorPosition position = edit.position();
        String range = String.format("[%d:%d - %d:%d]",
            position.startLine(), position.startColumn(), position.endLine(), position.endColumn());
        if (edit.type() == EditType.REPLACEMENT) {
            return "替换 " + range + " " + edit.replacedFrom() + " -> " + edit.replacedTo();
        }
        return "删除 " + range;
    }

    record StatementResult(QueryStatement statement, BreakdownResult result, List<EditDescriptor> edits) {
    }

    /**
     * 关闭时只刷新，不关闭底层的标准输出。
     */
    private static final class NonClosingOutputStream extends FilterOutputStream {
        private NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] bytes, int offset, int length) throws IOException {
            out.write(bytes, offset, length);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
