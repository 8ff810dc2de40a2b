package com.morphemizer.morph;

import com.morphemizer.config.Constants;

import java.util.List;

/**
 * 分词策略的公共基类：把一个表达式切分为有序的词素列表。
 *
 * <p>每个实例持有自己的记忆化缓存，键为未经任何规范化的原始表达式。
 * 子类只需实现 {@link #computeMorphemes(String)}。
 */
public abstract class Morphemizer {

    private final MorphemeCache cache;

    protected Morphemizer() {
        this(Constants.MORPHEME_CACHE_CAPACITY);
    }

    protected Morphemizer(int cacheCapacity) {
        this.cache = new MorphemeCache(cacheCapacity);
    }

    /**
     * 返回表达式的词素列表，相同表达式第二次调用直接命中缓存。
     *
     * @throws com.morphemizer.analyzer.AnalyzerException 外部分析服务失败时抛出，失败结果不会被缓存
     */
    public final List<Morpheme> getMorphemesFromExpr(String expression) {
        String key = expression == null ? "" : expression;
        List<Morpheme> cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        List<Morpheme> computed = List.copyOf(computeMorphemes(key));
        cache.put(key, computed);
        return computed;
    }

    /**
     * 实际的切分算法，不经过缓存。
     */
    protected List<Morpheme> computeMorphemes(String expression) {
        return List.of();
    }

    /**
     * 单行描述该分词器面向的语言或后端，不得抛出异常。
     */
    public String getDescription() {
        return "No information available";
    }

    /**
     * 稳定且唯一的名称，用作注册表键。
     */
    public abstract String getName();

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
    }

    @Override
    public String toString() {
        return getName();
    }
}
