package com.querybreakdown.search;

import com.querybreakdown.location.InvalidPositionException;

/**
 * 在查询文本上按行列闭区间执行删除与替换。
 *
 * <p>跨行编辑会在编辑点补一个换行，使区间之后的文本独占一行，与 LocationTracker 的映射保持一致。
 */
public final class QueryEditor {
    private QueryEditor() {
    }

    /**
     * 返回闭区间对应的字符下标范围 [start, endExclusive)。
     */
    public static int[] indexRange(String query, int startLine, int startColumn, int endLine, int endColumn) {
        int start = offsetOf(query, startLine, startColumn);
        int end = offsetOf(query, endLine, endColumn) + 1;
        if (end <= start) {
            throw new InvalidPositionException(startLine, startColumn,
                "区间结束位置 (" + endLine + ", " + endColumn + ") 早于起始位置");
        }
        return new int[] {start, end};
    }

    public static String fragment(String query, int startLine, int startColumn, int endLine, int endColumn) {
        int[] range = indexRange(query, startLine, startColumn, endLine, endColumn);
        return query.substring(range[0], range[1]);
    }

    public static String delete(String query, int startLine, int startColumn, int endLine, int endColumn) {
        int[] range = indexRange(query, startLine, startColumn, endLine, endColumn);
        StringBuilder builder = new StringBuilder(query);
        builder.delete(range[0], range[1]);
        if (startLine != endLine) {
            builder.insert(range[0], '\n');
        }
        return builder.toString();
    }

    public static String replace(String query, int startLine, int startColumn, int endLine, int endColumn,
                                 String replacement) {
        int[] range = indexRange(query, startLine, startColumn, endLine, endColumn);
        StringBuilder builder = new StringBuilder(query);
        builder.replace(range[0], range[1], replacement);
        if (startLine != endLine) {
            builder.insert(range[0] + replacement.length(), '\n');
        }
        return builder.toString();
    }

    /**
     * 返回 (line, column) 处字符的下标，位置不存在时抛出 InvalidPositionException。
     */
    static int offsetOf(String query, int line, int column) {
        if (line < 1 || column < 1) {
            throw new InvalidPositionException(line, column, "行列号必须从 1 开始");
        }
        int lineStart = 0;
        for (int current = 1; current < line; current++) {
            int newline = query.indexOf('\n', lineStart);
            if (newline < 0) {
                throw new InvalidPositionException(line, column, "行号越界");
            }
            lineStart = newline + 1;
        }
        int lineEnd = query.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = query.length();
        }
        if (lineStart + column - 1 >= lineEnd) {
            throw new InvalidPositionException(line, column, "列号越界");
        }
        return lineStart + column - 1;
    }
}
