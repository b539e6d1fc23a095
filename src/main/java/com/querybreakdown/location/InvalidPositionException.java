package com.querybreakdown.location;

/**
 * 位置无法映射回原始查询时抛出，说明编辑与位置跟踪不一致。
 */
public class InvalidPositionException extends IllegalStateException {
    private final int line;
    private final int column;

    public InvalidPositionException(int line, int column, String reason) {
        super("无法映射位置 (" + line + ", " + column + "): " + reason);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
