package com.querybreakdown.io;

/**
 * 输入文件中的一条语句及其在文件中的起始位置（行列从 1 开始）。
 */
public record QueryStatement(String text, int startLine, int startColumn) {

    public int lineOffset() {
        return startLine - 1;
    }

    public int firstLineColumnOffset() {
        return startColumn - 1;
    }
}
