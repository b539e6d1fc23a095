package com.querybreakdown.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 搜索运行时配置
 * 
 * 支持从配置文件（JSON）或CLI参数注入，覆盖Constants默认值
 */
public class BreakdownConfig {
    private static final Logger logger = LoggerFactory.getLogger(BreakdownConfig.class);

    private long timeLimitMillis = Constants.DEFAULT_TIME_LIMIT_MILLIS;
    private int replacementLimit = Constants.DEFAULT_REPLACEMENT_LIMIT;
    private int maxDepth = Constants.DEFAULT_MAX_DEPTH;
    private Long seed;
    private String lex = Constants.DEFAULT_LEX;

    public long getTimeLimitMillis() {
        return timeLimitMillis;
    }

    public void setTimeLimitMillis(long timeLimitMillis) {
        this.timeLimitMillis = timeLimitMillis;
    }

    public int getReplacementLimit() {
        return replacementLimit;
    }

    public void setReplacementLimit(int replacementLimit) {
        this.replacementLimit = replacementLimit;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public String getLex() {
        return lex;
    }

    public void setLex(String lex) {
        this.lex = lex;
    }

    public Duration timeLimit() {
        return Duration.ofMillis(timeLimitMillis);
    }

    /**
     * 将越界参数收敛到合法范围，并记录告警。
     */
    public BreakdownConfig sanitize() {
        if (timeLimitMillis <= 0) {
            logger.warn("非法时间上限 {}ms，已回退为默认值 {}ms", timeLimitMillis, Constants.DEFAULT_TIME_LIMIT_MILLIS);
            timeLimitMillis = Constants.DEFAULT_TIME_LIMIT_MILLIS;
        } else if (timeLimitMillis > Constants.MAX_TIME_LIMIT_MILLIS) {
            logger.warn("时间上限 {}ms 超过安全上限 {}ms，已自动限制", timeLimitMillis, Constants.MAX_TIME_LIMIT_MILLIS);
            timeLimitMillis = Constants.MAX_TIME_LIMIT_MILLIS;
        }
        if (replacementLimit < 0) {
            logger.warn("非法替换数 {}，已使用 0", replacementLimit);
            replacementLimit = 0;
        } else if (replacementLimit > Constants.MAX_REPLACEMENT_LIMIT) {
            logger.warn("替换数 {} 超过上限 {}，已自动限制", replacementLimit, Constants.MAX_REPLACEMENT_LIMIT);
            replacementLimit = Constants.MAX_REPLACEMENT_LIMIT;
        }
        if (maxDepth <= 0) {
            logger.warn("非法搜索深度 {}，已回退为默认值 {}", maxDepth, Constants.DEFAULT_MAX_DEPTH);
            maxDepth = Constants.DEFAULT_MAX_DEPTH;
        }
        if (lex == null || lex.isBlank()) {
            lex = Constants.DEFAULT_LEX;
        }
        return this;
    }

    /**
     * 使用默认配置创建实例
     */
    public static BreakdownConfig defaults() {
        return new BreakdownConfig();
    }

    /**
     * 从 JSON 配置文件加载，未知字段视为错误。
     */
    public static BreakdownConfig load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        return mapper.readValue(Files.readString(path), BreakdownConfig.class);
    }
}
