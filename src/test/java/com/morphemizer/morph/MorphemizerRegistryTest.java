package com.morphemizer.morph;

import com.morphemizer.config.MorphConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MorphemizerRegistryTest {

    private MorphemizerRegistry newRegistry() {
        MorphConfig config = MorphConfig.defaults();
        config.setCacheCapacity(32);
        return new MorphemizerRegistry(config, new RecordingJapaneseAnalyzer(), new RecordingChineseSegmenter());
    }

    @Test
    @DisplayName("MorphemizerRegistry: 固定顺序的五个分词器")
    void testFixedOrder() {
        List<Morphemizer> morphemizers = newRegistry().getAllMorphemizers();

        assertEquals(5, morphemizers.size());
        assertInstanceOf(SpaceMorphemizer.class, morphemizers.get(0));
        assertInstanceOf(JapaneseMorphemizer.class, morphemizers.get(1));
        assertInstanceOf(ChineseMorphemizer.class, morphemizers.get(2));
        assertInstanceOf(CjkCharMorphemizer.class, morphemizers.get(3));
        assertInstanceOf(VietnameseMorphemizer.class, morphemizers.get(4));
        assertEquals(32, morphemizers.get(0).getCacheStats().capacity());
    }

    @Test
    @DisplayName("MorphemizerRegistry: 重复访问返回同一批实例")
    void testStableIdentity() {
        MorphemizerRegistry registry = newRegistry();

        List<Morphemizer> first = registry.getAllMorphemizers();
        List<Morphemizer> second = registry.getAllMorphemizers();

        assertSame(first, second);
        for (int index = 0; index < first.size(); index++) {
            assertSame(first.get(index), second.get(index));
        }
        assertThrows(UnsupportedOperationException.class, () -> first.remove(0));
    }

    @Test
    @DisplayName("MorphemizerRegistry: 按名称查找")
    void testLookupByName() {
        MorphemizerRegistry registry = newRegistry();

        for (Morphemizer morphemizer : registry.getAllMorphemizers()) {
            assertSame(morphemizer, registry.getMorphemizerByName(morphemizer.getName()).orElseThrow());
        }
        assertTrue(registry.getMorphemizerByName("Klingon").isEmpty());
        assertTrue(registry.getMorphemizerByName(null).isEmpty());
    }

    @Test
    @DisplayName("MorphemizerRegistry: 名称互不相同")
    void testNamesAreDistinct() {
        Set<String> names = newRegistry().getAllMorphemizers().stream()
            .map(Morphemizer::getName)
            .collect(Collectors.toSet());

        assertEquals(Set.of("SpaceMorphemizer", "JapaneseMorphemizer", "ChineseMorphemizer",
            "CjkCharMorphemizer", "VietnameseMorphemizer"), names);
    }

    @Test
    @DisplayName("MorphemizerRegistry: 默认后端可构建且不立即加载词典")
    void testCreateDefault() {
        MorphemizerRegistry registry = MorphemizerRegistry.createDefault(MorphConfig.defaults());

        assertEquals(5, registry.getAllMorphemizers().size());
        assertEquals("Vietnamese", registry.getMorphemizerByName("VietnameseMorphemizer").orElseThrow().getDescription());
    }
}
