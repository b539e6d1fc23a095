package com.querybreakdown.result;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.querybreakdown.location.Position;

@JsonPropertyOrder({"startLine", "startColumn", "endLine", "endColumn"})
public record ErrorPosition(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn
) {
    public static ErrorPosition of(Position start, Position end) {
        return new ErrorPosition(start.line(), start.column(), end.line(), end.column());
    }

    /**
     * 将语句内的位置平移到所在文件中的位置。语句第一行的列号需要加上语句起始列偏移。
     */
    public ErrorPosition shift(int lineOffset, int firstLineColumnOffset) {
        return new ErrorPosition(
            startLine + lineOffset,
            startLine == 1 ? startColumn + firstLineColumnOffset : startColumn,
            endLine + lineOffset,
            endLine == 1 ? endColumn + firstLineColumnOffset : endColumn);
    }
}
