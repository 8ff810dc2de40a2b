package com.morphemizer.morph;

public record CacheStats(
    long hitCount,
    long missCount,
    int size,
    int capacity
) {
}
