package com.querybreakdown.parser;

import com.querybreakdown.config.Constants;

import java.util.List;
import java.util.Set;

public class SqlSyntaxException extends RuntimeException {
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final Set<String> expectedTokens;
    private final String causeText;

    public SqlSyntaxException(String message, int startLine, int startColumn, int endLine, int endColumn,
                              Set<String> expectedTokens, String causeText) {
        super(message);
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.expectedTokens = expectedTokens == null ? Set.of() : expectedTokens;
        this.causeText = causeText == null ? "" : causeText;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    /**
     * 解析器在错误位置接受的 token 描述，可能带引号或为 {@code <IDENTIFIER>} 这类词法类别。
     */
    public Set<String> getExpectedTokens() {
        return expectedTokens;
    }

    public List<String> expectedTokenList() {
        return expectedTokens.stream().toList();
    }

    public String getCauseText() {
        return causeText;
    }

    /**
     * 判断错误能否定位到具体片段：位置为 0、输入末尾错误与校验错误都无法通过编辑修复。
     */
    public boolean isLocatable() {
        if (startLine == 0 || startColumn == 0) {
            return false;
        }
        return !causeText.contains(Constants.EOF_MARKER)
            && !causeText.contains(Constants.EOF_LEXICAL_MARKER)
            && !causeText.contains(Constants.VALIDATOR_MARKER);
    }
}
