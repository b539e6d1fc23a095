package com.querybreakdown.search;

import com.querybreakdown.config.BreakdownConfig;
import com.querybreakdown.config.Constants;
import com.querybreakdown.location.InvalidPositionException;
import com.querybreakdown.location.LocationTracker;
import com.querybreakdown.location.Position;
import com.querybreakdown.parser.QueryParser;
import com.querybreakdown.parser.SqlSyntaxException;
import com.querybreakdown.result.BreakdownResult;
import com.querybreakdown.result.EditDescriptor;
import com.querybreakdown.result.TraceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 查找使查询可解析所需的最少编辑。
 *
 * <p>对解析器报告的每个错误片段先尝试删除，再依次尝试替换为期望 token，深度优先递归，
 * 记录编辑步数最少的可解析版本。搜索在独立线程中运行，超过时间上限后取消，
 * 已找到的解作为部分结果返回；一个解都没有时返回覆盖整个查询的删除。
 */
public class QueryBreakdown {
    private static final Logger logger = LoggerFactory.getLogger(QueryBreakdown.class);

    private final QueryParser parser;
    private final int maxDepth;
    private final Long seed;

    public QueryBreakdown(QueryParser parser) {
        this(parser, BreakdownConfig.defaults());
    }

    public QueryBreakdown(QueryParser parser, BreakdownConfig config) {
        this.parser = parser;
        this.maxDepth = config.getMaxDepth();
        this.seed = config.getSeed();
    }

    /**
     * 在时间上限内搜索 query 的最少编辑。
     */
    public BreakdownResult run(String query, Duration timeLimit, int replacementLimit) {
        long startNanos = System.nanoTime();
        if (query == null || query.isEmpty()) {
            return BreakdownResult.parseable("", 0, 0);
        }

        ReplacementSelector selector = new ReplacementSelector(replacementLimit, seed == null ? new Random() : new Random(seed));
        LocationTracker tracker = LocationTracker.of(query);
        SearchState state = new SearchState();
        AtomicBoolean cancelled = new AtomicBoolean(false);

        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "query-breakdown-search");
            thread.setDaemon(true);
            return thread;
        });
        boolean timedOut = false;
        try {
            Future<?> future = executor.submit(() ->
                new Search(selector, state, cancelled).explore(query, EditNode.root(), 0, tracker));
            try {
                future.get(timeLimit.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException exception) {
                timedOut = true;
                cancelled.set(true);
                future.cancel(true);
                logger.warn("搜索超过时间上限 {}ms，已取消", timeLimit.toMillis());
            } catch (ExecutionException exception) {
                Throwable cause = exception.getCause();
                if (cause instanceof InvalidPositionException invalidPosition) {
                    throw invalidPosition;
                }
                throw new BreakdownException("搜索失败: " + cause.getMessage(), cause);
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                cancelled.set(true);
                future.cancel(true);
                timedOut = true;
            }
        } finally {
            executor.shutdownNow();
            awaitWorker(executor);
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        SearchState.Snapshot snapshot = state.snapshot();
        logger.debug("搜索结束: 解析 {} 次，最优深度 {}，用时 {}ms", snapshot.parseAttempts(), snapshot.bestDepth(), elapsedMs);

        if (!snapshot.hasSolution()) {
            return fallback(query, tracker, timedOut, snapshot.parseAttempts(), elapsedMs);
        }
        List<EditDescriptor> edits = TraceBuilder.build(snapshot.bestLeaf());
        return new BreakdownResult(query, snapshot.repairedQuery(), edits, timedOut, false,
            snapshot.parseAttempts(), elapsedMs);
    }

    public BreakdownResult run(String query, BreakdownConfig config) {
        return run(query, config.timeLimit(), config.getReplacementLimit());
    }

    private static BreakdownResult fallback(String query, LocationTracker tracker, boolean timedOut,
                                            long parseAttempts, long elapsedMs) {
        if (tracker.isEmpty()) {
            // 只有换行的查询没有可标记的字符
            return new BreakdownResult(query, "", List.of(), timedOut, true, parseAttempts, elapsedMs);
        }
        Position first = tracker.firstPosition();
        Position last = tracker.lastPosition();
        EditDescriptor deletion = EditDescriptor.from(EditNode.deletion(EditNode.root(), first, last, query.length()));
        return new BreakdownResult(query, "", List.of(deletion), timedOut, true, parseAttempts, elapsedMs);
    }

    private static void awaitWorker(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(Constants.CANCEL_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                logger.warn("搜索线程未在 {}ms 内退出", Constants.CANCEL_GRACE_MILLIS);
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 单次运行的递归搜索，持有本次运行的选择器、状态与取消标志。
     */
    private final class Search {
        private final ReplacementSelector selector;
        private final SearchState state;
        private final AtomicBoolean cancelled;

        private Search(ReplacementSelector selector, SearchState state, AtomicBoolean cancelled) {
            this.selector = selector;
            this.state = state;
            this.cancelled = cancelled;
        }

        private void explore(String query, EditNode parent, int depth, LocationTracker tracker) {
            if (depth > state.bestDepth() || depth > maxDepth) {
                return;
            }
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                throw new SearchCancelledException();
            }

            SqlSyntaxException error;
            try {
                state.countParseAttempt();
                parser.parse(query);
                if (state.offer(parent, depth, query)) {
                    logger.debug("找到深度 {} 的可解析版本", depth);
                }
                return;
            } catch (SqlSyntaxException exception) {
                error = exception;
            } catch (RuntimeException exception) {
                logger.debug("解析器异常，放弃该分支: {}", exception.toString());
                return;
            }

            if (!error.isLocatable()) {
                logger.debug("错误无法定位，放弃该分支: {}", error.getCauseText());
                return;
            }

            int startLine = error.getStartLine();
            int startColumn = error.getStartColumn();
            int endLine = error.getEndLine();
            int endColumn = error.getEndColumn();
            Position originalStart = tracker.translate(startLine, startColumn);
            Position originalEnd = tracker.translate(endLine, endColumn);

            // 删除
            String deleted = QueryEditor.delete(query, startLine, startColumn, endLine, endColumn);
            int deletedChars = query.length() - deleted.length() + (startLine == endLine ? 0 : 1);
            EditNode deletion = EditNode.deletion(parent, originalStart, originalEnd, deletedChars);
            explore(deleted, deletion, depth + 1,
                tracker.afterDeletion(startLine, startColumn, endLine, endColumn));

            // 替换
            List<ReplacementCandidate> candidates = selector.candidates(query, startLine, startColumn,
                endLine, endColumn, error.getExpectedTokens());
            for (ReplacementCandidate candidate : candidates) {
                EditNode replacement = EditNode.replacement(parent, originalStart, originalEnd,
                    candidate.original(), candidate.replacement(), candidate.original().length());
                explore(candidate.query(), replacement, depth + 1,
                    tracker.afterReplacement(startLine, startColumn, endLine, endColumn,
                        candidate.original(), candidate.replacement()));
            }
        }
    }
}
