package com.querybreakdown.parser;

import com.querybreakdown.config.Constants;
import org.apache.calcite.config.Lex;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.SqlParserPos;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 基于 Apache Calcite 的查询解析器。
 */
public class CalciteQueryParser implements QueryParser {
    private final SqlParser.Config config;

    public CalciteQueryParser() {
        this(Constants.DEFAULT_LEX);
    }

    public CalciteQueryParser(String lexName) {
        this.config = SqlParser.config().withLex(resolveLex(lexName));
    }

    @Override
    public void parse(String query) {
        try {
            SqlParser.create(query, config).parseQuery();
        } catch (SqlParseException exception) {
            throw toSyntaxException(exception);
        }
    }

    static SqlSyntaxException toSyntaxException(SqlParseException exception) {
        SqlParserPos pos = exception.getPos();
        Set<String> expected = exception.getExpectedTokenNames() == null
            ? Set.of()
            : new LinkedHashSet<>(exception.getExpectedTokenNames());
        String causeText = exception.getCause() == null
            ? exception.getMessage()
            : exception.getCause().toString();
        if (pos == null) {
            return new SqlSyntaxException(exception.getMessage(), 0, 0, 0, 0, expected, causeText);
        }
        return new SqlSyntaxException(exception.getMessage(),
            pos.getLineNum(), pos.getColumnNum(), pos.getEndLineNum(), pos.getEndColumnNum(),
            expected, causeText);
    }

    static Lex resolveLex(String lexName) {
        if (lexName == null || lexName.isBlank()) {
            return Lex.valueOf(Constants.DEFAULT_LEX);
        }
        try {
            return Lex.valueOf(lexName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("不支持的词法规则: " + lexName, exception);
        }
    }
}
