package com.querybreakdown.result;

import java.util.List;

/**
 * 一次搜索的结果。
 *
 * <p>{@code fallback} 为 true 表示没有找到任何可解析的版本，edits 中只有覆盖整个查询的删除。
 */
public record BreakdownResult(
        String originalQuery,
        String repairedQuery,
        List<EditDescriptor> edits,
        boolean timedOut,
        boolean fallback,
        long parseAttempts,
        long elapsedMs
) {
    public static BreakdownResult parseable(String query, long parseAttempts, long elapsedMs) {
        return new BreakdownResult(query, query, List.of(), false, false, parseAttempts, elapsedMs);
    }

    public boolean isParseable() {
        return edits.isEmpty();
    }

    public int depth() {
        return edits.size();
    }

    /**
     * 所有编辑影响的字符数之和。
     */
    public int unparseableCharacters() {
        return edits.stream().mapToInt(EditDescriptor::cost).sum();
    }

    /**
     * 可解析字符占原始查询的百分比。
     */
    public double parseablePercentage() {
        if (originalQuery == null || originalQuery.isEmpty()) {
            return 100.0;
        }
        int parseable = Math.max(0, originalQuery.length() - unparseableCharacters());
        return parseable * 100.0 / originalQuery.length();
    }
}
