package com.morphemizer.morph;

import com.morphemizer.analyzer.ChineseSegmenter;
import com.morphemizer.analyzer.HanLpChineseSegmenter;
import com.morphemizer.analyzer.JapaneseAnalyzer;
import com.morphemizer.analyzer.KuromojiJapaneseAnalyzer;
import com.morphemizer.config.MorphConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 固定的五个分词器单例，首次访问时按以下顺序构建：
 * 空格、日语、中文、CJK单字、越南语。之后组成与顺序不再改变。
 */
public final class MorphemizerRegistry {

    private final MorphConfig config;
    private final JapaneseAnalyzer japaneseAnalyzer;
    private final ChineseSegmenter chineseSegmenter;

    private volatile List<Morphemizer> morphemizers;
    private Map<String, Morphemizer> morphemizersByName = Map.of();

    public MorphemizerRegistry(MorphConfig config, JapaneseAnalyzer japaneseAnalyzer, ChineseSegmenter chineseSegmenter) {
        this.config = Objects.requireNonNull(config, "config");
        this.japaneseAnalyzer = Objects.requireNonNull(japaneseAnalyzer, "japaneseAnalyzer");
        this.chineseSegmenter = Objects.requireNonNull(chineseSegmenter, "chineseSegmenter");
    }

    /**
     * 使用 Kuromoji 与 HanLP 作为外部解析后端。
     */
    public static MorphemizerRegistry createDefault(MorphConfig config) {
        return new MorphemizerRegistry(config, new KuromojiJapaneseAnalyzer(), new HanLpChineseSegmenter());
    }

    public List<Morphemizer> getAllMorphemizers() {
        List<Morphemizer> current = morphemizers;
        if (current == null) {
            synchronized (this) {
                current = morphemizers;
                if (current == null) {
                    current = build();
                    morphemizers = current;
                }
            }
        }
        return current;
    }

    public Optional<Morphemizer> getMorphemizerByName(String name) {
        getAllMorphemizers();
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(morphemizersByName.get(name));
    }

    private List<Morphemizer> build() {
        int cacheCapacity = config.getCacheCapacity();
        List<Morphemizer> created = List.of(
            new SpaceMorphemizer(cacheCapacity),
            new JapaneseMorphemizer(japaneseAnalyzer, cacheCapacity),
            new ChineseMorphemizer(chineseSegmenter, cacheCapacity),
            new CjkCharMorphemizer(cacheCapacity),
            new VietnameseMorphemizer(config.getPreferences(), cacheCapacity)
        );

        Map<String, Morphemizer> byName = new HashMap<>();
        for (Morphemizer morphemizer : created) {
            if (byName.put(morphemizer.getName(), morphemizer) != null) {
                throw new IllegalStateException("分词器名称重复: " + morphemizer.getName());
            }
        }
        morphemizersByName = Map.copyOf(byName);
        return created;
    }
}
