package com.querybreakdown.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取输入文件并按分号切分为语句。
 *
 * <p>引号、反引号与注释中的分号不作为分隔符。每条语句去掉首尾空白，并记录起始位置，
 * 以便把语句内的错误位置换算回文件中的位置。
 */
public class InputReader {

    public List<QueryStatement> read(Path path) throws IOException {
        return split(Files.readString(path, StandardCharsets.UTF_8));
    }

    public List<QueryStatement> split(String content) {
        String text = content == null ? "" : content.replace("\r\n", "\n").replace('\r', '\n');
        List<QueryStatement> statements = new ArrayList<>();

        int segmentStart = 0;
        int index = 0;
        char quote = 0;
        boolean lineComment = false;
        boolean blockComment = false;
        while (index < text.length()) {
            char ch = text.charAt(index);
            char next = index + 1 < text.length() ? text.charAt(index + 1) : 0;
            if (lineComment) {
                if (ch == '\n') {
                    lineComment = false;
                }
            } else if (blockComment) {
                if (ch == '*' && next == '/') {
                    blockComment = false;
                    index++;
                }
            } else if (quote != 0) {
                if (ch == '\\' && quote != '`') {
                    index++;
                } else if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '\'' || ch == '"' || ch == '`') {
                quote = ch;
            } else if (ch == '-' && next == '-') {
                lineComment = true;
                index++;
            } else if (ch == '#') {
                lineComment = true;
            } else if (ch == '/' && next == '*') {
                blockComment = true;
                index++;
            } else if (ch == ';') {
                addStatement(text, segmentStart, index, statements);
                segmentStart = index + 1;
            }
            index++;
        }
        addStatement(text, segmentStart, text.length(), statements);
        return statements;
    }

    private void addStatement(String text, int from, int to, List<QueryStatement> statements) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start >= end) {
            return;
        }
        int line = 1;
        int lineStart = 0;
        for (int index = 0; index < start; index++) {
            if (text.charAt(index) == '\n') {
                line++;
                lineStart = index + 1;
            }
        }
        statements.add(new QueryStatement(text.substring(start, end), line, start - lineStart + 1));
    }
}
