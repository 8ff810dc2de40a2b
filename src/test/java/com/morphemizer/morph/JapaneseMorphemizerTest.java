package com.morphemizer.morph;

import com.morphemizer.analyzer.AnalyzerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JapaneseMorphemizerTest {

    @Test
    @DisplayName("JapaneseMorphemizer: 去掉半角空格后交给解析器")
    void testRemovesSpacesBeforeDelegation() {
        RecordingJapaneseAnalyzer analyzer = new RecordingJapaneseAnalyzer();
        JapaneseMorphemizer morphemizer = new JapaneseMorphemizer(analyzer, 16);

        List<Morpheme> morphemes = morphemizer.getMorphemesFromExpr("日本 語　だ");

        assertEquals(List.of("日本語　だ"), analyzer.receivedTexts);
        assertEquals(5, morphemes.size());
        assertEquals(new Morpheme("日", "日", "日", "日", "名詞", "一般"), morphemes.get(0));
    }

    @Test
    @DisplayName("JapaneseMorphemizer: 只有空格时不调用解析器")
    void testOnlySpaces() {
        RecordingJapaneseAnalyzer analyzer = new RecordingJapaneseAnalyzer();
        JapaneseMorphemizer morphemizer = new JapaneseMorphemizer(analyzer, 16);

        assertTrue(morphemizer.getMorphemesFromExpr("   ").isEmpty());
        assertTrue(analyzer.receivedTexts.isEmpty());
    }

    @Test
    @DisplayName("JapaneseMorphemizer: 缓存命中不再调用解析器")
    void testCachedResult() {
        RecordingJapaneseAnalyzer analyzer = new RecordingJapaneseAnalyzer();
        JapaneseMorphemizer morphemizer = new JapaneseMorphemizer(analyzer, 16);

        morphemizer.getMorphemesFromExpr("猫");
        morphemizer.getMorphemesFromExpr("猫");

        assertEquals(1, analyzer.receivedTexts.size());
    }

    @Test
    @DisplayName("JapaneseMorphemizer: 解析失败向调用方抛出且不缓存")
    void testAnalyzerFailurePropagates() {
        RecordingJapaneseAnalyzer analyzer = new RecordingJapaneseAnalyzer();
        analyzer.analyzeFailure = new IllegalStateException("mecab not running");
        JapaneseMorphemizer morphemizer = new JapaneseMorphemizer(analyzer, 16);

        AnalyzerException first = assertThrows(AnalyzerException.class, () -> morphemizer.getMorphemesFromExpr("猫"));
        assertEquals(JapaneseMorphemizer.NAME, first.getBackend());
        assertInstanceOf(IllegalStateException.class, first.getCause());

        assertThrows(AnalyzerException.class, () -> morphemizer.getMorphemesFromExpr("猫"));
        assertEquals(2, analyzer.receivedTexts.size());
        assertEquals(0, morphemizer.getCacheStats().size());
    }

    @Test
    @DisplayName("JapaneseMorphemizer: AnalyzerException 原样抛出")
    void testAnalyzerExceptionNotWrapped() {
        RecordingJapaneseAnalyzer analyzer = new RecordingJapaneseAnalyzer();
        AnalyzerException failure = new AnalyzerException("kuromoji", "boom", null);
        analyzer.analyzeFailure = failure;
        JapaneseMorphemizer morphemizer = new JapaneseMorphemizer(analyzer, 16);

        assertSame(failure, assertThrows(AnalyzerException.class, () -> morphemizer.getMorphemesFromExpr("猫")));
    }

    @Test
    @DisplayName("JapaneseMorphemizer: 描述包含解析器标识，失败时为UNAVAILABLE")
    void testDescription() {
        RecordingJapaneseAnalyzer analyzer = new RecordingJapaneseAnalyzer();
        JapaneseMorphemizer morphemizer = new JapaneseMorphemizer(analyzer, 16);

        assertEquals("Japanese fake-0.1", morphemizer.getDescription());

        analyzer.identityFailure = new IllegalStateException("no binary");
        assertEquals("Japanese UNAVAILABLE", morphemizer.getDescription());
        assertEquals("JapaneseMorphemizer", morphemizer.getName());
    }
}
