package com.querybreakdown.search;

/**
 * 搜索线程在两次解析之间发现取消请求时抛出，用于展开递归。
 */
public class SearchCancelledException extends RuntimeException {
    public SearchCancelledException() {
        super("搜索已取消", null, false, false);
    }
}
