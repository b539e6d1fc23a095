package com.querybreakdown.parser;

/**
 * SQL 解析能力。
 */
public interface QueryParser {

    /**
     * 尝试解析查询，成功时正常返回，失败时抛出携带错误位置与期望 token 的 {@link SqlSyntaxException}。
     */
    void parse(String query);
}
