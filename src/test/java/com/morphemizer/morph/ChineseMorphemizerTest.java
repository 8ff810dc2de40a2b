package com.morphemizer.morph;

import com.morphemizer.analyzer.AnalyzerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChineseMorphemizerTest {

    @Test
    @DisplayName("ChineseMorphemizer: 过滤标点与拉丁字母后再分词")
    void testFiltersBeforeDelegation() {
        RecordingChineseSegmenter segmenter = new RecordingChineseSegmenter();
        ChineseMorphemizer morphemizer = new ChineseMorphemizer(segmenter, 16);

        List<Morpheme> morphemes = morphemizer.getMorphemesFromExpr("我爱 Java，北京！");

        assertEquals(List.of("我爱北京"), segmenter.receivedTexts);
        assertEquals(2, morphemes.size());
        assertEquals(new Morpheme("我爱", "我爱", "我爱", "我爱", "n", "UNKNOWN"), morphemes.get(0));
        assertEquals(new Morpheme("北京", "北京", "北京", "北京", "n", "UNKNOWN"), morphemes.get(1));
    }

    @Test
    @DisplayName("ChineseMorphemizer: 没有汉字时不调用分词器")
    void testNoIdeographs() {
        RecordingChineseSegmenter segmenter = new RecordingChineseSegmenter();
        ChineseMorphemizer morphemizer = new ChineseMorphemizer(segmenter, 16);

        assertTrue(morphemizer.getMorphemesFromExpr("hello, world!").isEmpty());
        assertTrue(segmenter.receivedTexts.isEmpty());
    }

    @Test
    @DisplayName("ChineseMorphemizer: 分词失败向调用方抛出")
    void testSegmenterFailurePropagates() {
        RecordingChineseSegmenter segmenter = new RecordingChineseSegmenter();
        segmenter.failure = new IllegalStateException("dictionary missing");
        ChineseMorphemizer morphemizer = new ChineseMorphemizer(segmenter, 16);

        AnalyzerException exception = assertThrows(AnalyzerException.class, () -> morphemizer.getMorphemesFromExpr("中文"));
        assertEquals(ChineseMorphemizer.NAME, exception.getBackend());
    }

    @Test
    void testNameAndDescription() {
        ChineseMorphemizer morphemizer = new ChineseMorphemizer(new RecordingChineseSegmenter());

        assertEquals("ChineseMorphemizer", morphemizer.getName());
        assertEquals("Chinese", morphemizer.getDescription());
    }
}
