package com.querybreakdown.location;

/**
 * 查询文本中的位置，行列均从 1 开始。
 */
public record Position(int line, int column) {
}
