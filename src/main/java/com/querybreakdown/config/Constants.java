package com.querybreakdown.config;

/**
 * 全局常量定义
 * 
 * 包含搜索限制、替换候选参数、解析器错误标记和输入参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 搜索限制 ====================
    /** 默认搜索时间上限（毫秒） */
    public static final long DEFAULT_TIME_LIMIT_MILLIS = 10_000L;
    /** 搜索时间安全上限（10分钟） */
    public static final long MAX_TIME_LIMIT_MILLIS = 10L * 60 * 1000;
    /** 默认最大搜索深度，超过后剪枝 */
    public static final int DEFAULT_MAX_DEPTH = 64;
    /** 取消后等待搜索线程退出的宽限期（毫秒） */
    public static final long CANCEL_GRACE_MILLIS = 1_000L;

    // ==================== 替换参数 ====================
    /** 每个错误位置默认尝试的替换候选数 */
    public static final int DEFAULT_REPLACEMENT_LIMIT = 3;
    /** 替换候选数安全上限 */
    public static final int MAX_REPLACEMENT_LIMIT = 20;

    // ==================== 解析器错误标记 ====================
    /** 文件结束错误标记（语法错误发生在输入末尾） */
    public static final String EOF_MARKER = "Encountered \"<EOF>\"";
    /** 文件结束错误标记（词法错误形式） */
    public static final String EOF_LEXICAL_MARKER = "Encountered: <EOF>";
    /** 校验类错误标记，不属于语法错误 */
    public static final String VALIDATOR_MARKER = "SqlValidatorException";

    // ==================== 输入参数 ====================
    /** 单条查询最大字符数 */
    public static final int MAX_QUERY_LENGTH = 100_000;
    /** 默认 SQL 词法规则 */
    public static final String DEFAULT_LEX = "BIG_QUERY";
}
