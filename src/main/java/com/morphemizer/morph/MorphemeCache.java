package com.morphemizer.morph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按原始表达式精确匹配的有界LRU缓存，读写由实例锁保护。
 */
final class MorphemeCache {

    private final int capacity;
    private final Map<String, List<Morpheme>> entries;
    private long hitCount;
    private long missCount;

    MorphemeCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<Morpheme>> eldest) {
                return size() > MorphemeCache.this.capacity;
            }
        };
    }

    /**
     * 命中时返回缓存结果并刷新其LRU位置，未命中返回null。
     */
    synchronized List<Morpheme> get(String expression) {
        List<Morpheme> cached = entries.get(expression);
        if (cached == null) {
            missCount++;
        } else {
            hitCount++;
        }
        return cached;
    }

    synchronized void put(String expression, List<Morpheme> morphemes) {
        entries.put(expression, morphemes);
    }

    synchronized void clear() {
        entries.clear();
        hitCount = 0;
        missCount = 0;
    }

    synchronized CacheStats stats() {
        return new CacheStats(hitCount, missCount, entries.size(), capacity);
    }
}
