package com.querybreakdown.search;

import com.querybreakdown.config.Constants;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 根据解析器给出的期望 token 生成替换候选。
 */
public class ReplacementSelector {
    private final int limit;
    private final Random random;

    public ReplacementSelector() {
        this(Constants.DEFAULT_REPLACEMENT_LIMIT, new Random());
    }

    public ReplacementSelector(int limit, Random random) {
        this.limit = Math.max(0, limit);
        this.random = random;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * 在 query 的错误区间上逐一套用替换 token，生成新的查询。
     */
    public List<ReplacementCandidate> candidates(String query, int startLine, int startColumn,
                                                 int endLine, int endColumn, Collection<String> expectedTokens) {
        String fragment = QueryEditor.fragment(query, startLine, startColumn, endLine, endColumn);
        List<ReplacementCandidate> result = new ArrayList<>();
        for (String token : select(fragment, stripQuotes(expectedTokens))) {
            String replaced = QueryEditor.replace(query, startLine, startColumn, endLine, endColumn, token);
            result.add(new ReplacementCandidate(replaced, fragment, token));
        }
        return result;
    }

    /**
     * 从期望 token 中挑选至多 limit 个可直接插入的 token。
     *
     * <p>数量不超过 limit 时按原顺序返回全部非占位 token；否则无放回随机抽样，
     * 抽到占位 token 时只记为已见，因此结果可能少于 limit。
     */
    public List<String> select(String fragment, List<String> options) {
        List<String> result = new ArrayList<>();
        if (options.size() <= limit) {
            for (String option : options) {
                if (!isPlaceholder(option)) {
                    result.add(option);
                }
            }
            return result;
        }

        Set<Integer> seen = new HashSet<>();
        while (result.size() < limit && seen.size() < options.size()) {
            int index = random.nextInt(options.size());
            if (!seen.add(index)) {
                continue;
            }
            if (!isPlaceholder(options.get(index))) {
                result.add(options.get(index));
            }
        }
        return result;
    }

    /**
     * 去掉 token 描述中的引号，例如 {@code "FROM"} 变为 {@code FROM}。
     */
    static List<String> stripQuotes(Collection<String> expectedTokens) {
        List<String> filtered = new ArrayList<>();
        if (expectedTokens == null) {
            return filtered;
        }
        for (String token : expectedTokens) {
            String stripped = token.replace("\"", "");
            if (!stripped.isEmpty()) {
                filtered.add(stripped);
            }
        }
        return filtered;
    }

    /**
     * 形如 {@code <IDENTIFIER>} 的 token 表示词法类别，不能直接插入。
     */
    static boolean isPlaceholder(String token) {
        return token.length() > 1 && token.charAt(0) == '<';
    }
}
