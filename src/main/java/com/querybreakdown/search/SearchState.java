package com.querybreakdown.search;

/**
 * 单次搜索的最优解累加器，在递归调用间显式传递。
 *
 * <p>只由搜索线程写入；超时后调用线程读取快照，因此读写均加锁。
 */
public final class SearchState {
    private int bestDepth = Integer.MAX_VALUE;
    private EditNode bestLeaf;
    private String repairedQuery;
    private long parseAttempts;

    public synchronized int bestDepth() {
        return bestDepth;
    }

    /**
     * 深度严格小于当前最优时记录新解，返回是否记录。
     */
    public synchronized boolean offer(EditNode leaf, int depth, String query) {
        if (depth >= bestDepth) {
            return false;
        }
        bestDepth = depth;
        bestLeaf = leaf;
        repairedQuery = query;
        return true;
    }

    public synchronized void countParseAttempt() {
        parseAttempts++;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(bestLeaf, bestLeaf == null ? -1 : bestDepth, repairedQuery, parseAttempts);
    }

    /**
     * 搜索状态的不可变视图，bestLeaf 为 null 表示尚未找到可解析的叶子。
     */
    public record Snapshot(EditNode bestLeaf, int bestDepth, String repairedQuery, long parseAttempts) {
        public boolean hasSolution() {
            return bestLeaf != null;
        }
    }
}
