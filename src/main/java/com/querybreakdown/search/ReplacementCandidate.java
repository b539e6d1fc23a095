package com.querybreakdown.search;

/**
 * 一次替换的结果：替换后的完整查询、被替换片段与替换文本。
 */
public record ReplacementCandidate(String query, String original, String replacement) {
}
