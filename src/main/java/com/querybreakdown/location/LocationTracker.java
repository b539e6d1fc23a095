package com.querybreakdown.location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 记录编辑后文本中每个字符在原始查询中的位置。
 *
 * <p>实例不可变：每次删除或替换都返回新的跟踪器，搜索的各个分支可以独立持有自己的映射。
 * 所有区间均为闭区间，与解析器报告的错误位置一致。
 */
public final class LocationTracker {
    private final List<List<Position>> lines;

    private LocationTracker(List<List<Position>> lines) {
        this.lines = lines;
    }

    /**
     * 为未经编辑的查询创建恒等映射。
     */
    public static LocationTracker of(String query) {
        String text = query == null ? "" : query;
        List<List<Position>> lines = new ArrayList<>();
        List<Position> current = new ArrayList<>();
        int line = 1;
        int column = 1;
        for (int index = 0; index < text.length(); index++) {
            if (text.charAt(index) == '\n') {
                lines.add(Collections.unmodifiableList(current));
                current = new ArrayList<>();
                line++;
                column = 1;
                continue;
            }
            current.add(new Position(line, column++));
        }
        lines.add(Collections.unmodifiableList(current));
        return new LocationTracker(Collections.unmodifiableList(lines));
    }

    /**
     * 将当前文本中的位置映射回原始查询。
     */
    public Position translate(int line, int column) {
        if (line < 1 || line > lines.size()) {
            throw new InvalidPositionException(line, column, "行号越界，当前共 " + lines.size() + " 行");
        }
        List<Position> row = lines.get(line - 1);
        if (column < 1 || column > row.size()) {
            throw new InvalidPositionException(line, column, "列号越界，该行共 " + row.size() + " 列");
        }
        return row.get(column - 1);
    }

    public Position translate(Position position) {
        return translate(position.line(), position.column());
    }

    /**
     * 返回删除闭区间 [start, end] 之后的跟踪器。
     */
    public LocationTracker afterDeletion(int startLine, int startColumn, int endLine, int endColumn) {
        return splice(startLine, startColumn, endLine, endColumn, List.of());
    }

    /**
     * 返回以 replacementText 替换闭区间 [start, end] 之后的跟踪器。
     *
     * <p>替换文本的第 i 列映射到被替换片段第 i 个字符的原始位置，超出部分映射到片段最后一个字符。
     */
    public LocationTracker afterReplacement(int startLine, int startColumn, int endLine, int endColumn,
                                            String originalText, String replacementText) {
        List<Position> replaced = collectSpan(startLine, startColumn, endLine, endColumn);
        int length = replacementText == null ? 0 : replacementText.length();
        List<Position> substitute = new ArrayList<>(length);
        for (int index = 0; index < length; index++) {
            substitute.add(replaced.get(Math.min(index, replaced.size() - 1)));
        }
        return splice(startLine, startColumn, endLine, endColumn, substitute);
    }

    /**
     * 当前文本第一个字符的原始位置。
     */
    public Position firstPosition() {
        for (List<Position> row : lines) {
            if (!row.isEmpty()) {
                return row.get(0);
            }
        }
        throw new InvalidPositionException(1, 1, "文本为空");
    }

    /**
     * 当前文本最后一个字符的原始位置。
     */
    public Position lastPosition() {
        for (int index = lines.size() - 1; index >= 0; index--) {
            List<Position> row = lines.get(index);
            if (!row.isEmpty()) {
                return row.get(row.size() - 1);
            }
        }
        throw new InvalidPositionException(1, 1, "文本为空");
    }

    public boolean isEmpty() {
        return lines.stream().allMatch(List::isEmpty);
    }

    public int lineCount() {
        return lines.size();
    }

    public int lineLength(int line) {
        if (line < 1 || line > lines.size()) {
            throw new InvalidPositionException(line, 1, "行号越界，当前共 " + lines.size() + " 行");
        }
        return lines.get(line - 1).size();
    }

    private List<Position> collectSpan(int startLine, int startColumn, int endLine, int endColumn) {
        validateSpan(startLine, startColumn, endLine, endColumn);
        List<Position> span = new ArrayList<>();
        for (int line = startLine; line <= endLine; line++) {
            List<Position> row = lines.get(line - 1);
            int from = line == startLine ? startColumn - 1 : 0;
            int to = line == endLine ? endColumn : row.size();
            span.addAll(row.subList(from, to));
        }
        return span;
    }

    private LocationTracker splice(int startLine, int startColumn, int endLine, int endColumn,
                                   List<Position> substitute) {
        validateSpan(startLine, startColumn, endLine, endColumn);
        List<Position> startRow = lines.get(startLine - 1);
        List<Position> endRow = lines.get(endLine - 1);

        List<Position> head = new ArrayList<>(startRow.subList(0, startColumn - 1));
        head.addAll(substitute);
        List<Position> tail = new ArrayList<>(endRow.subList(endColumn, endRow.size()));

        List<List<Position>> result = new ArrayList<>(lines.size());
        result.addAll(lines.subList(0, startLine - 1));
        if (startLine == endLine) {
            head.addAll(tail);
            result.add(Collections.unmodifiableList(head));
        } else {
            // 跨行编辑在编辑点插入换行，剩余部分独占一行
            result.add(Collections.unmodifiableList(head));
            result.add(Collections.unmodifiableList(tail));
        }
        result.addAll(lines.subList(endLine, lines.size()));
        return new LocationTracker(Collections.unmodifiableList(result));
    }

    private void validateSpan(int startLine, int startColumn, int endLine, int endColumn) {
        translate(startLine, startColumn);
        translate(endLine, endColumn);
        if (endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw new InvalidPositionException(startLine, startColumn,
                "区间结束位置 (" + endLine + ", " + endColumn + ") 早于起始位置");
        }
    }
}
