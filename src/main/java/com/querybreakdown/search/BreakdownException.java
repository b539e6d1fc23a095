package com.querybreakdown.search;

/**
 * 搜索过程中出现无法在分支内恢复的错误。
 */
public class BreakdownException extends RuntimeException {
    public BreakdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
