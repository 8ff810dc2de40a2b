package com.morphemizer.analyzer;

public record TaggedWord(
    String word,
    String flag
) {
}
