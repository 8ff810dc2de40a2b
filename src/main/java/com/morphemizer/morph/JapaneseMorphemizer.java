package com.morphemizer.morph;

import com.morphemizer.analyzer.AnalyzerException;
import com.morphemizer.analyzer.JapaneseAnalyzer;
import com.morphemizer.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 日语词之间没有空格，切分交给外部形态素解析器完成。
 */
public class JapaneseMorphemizer extends Morphemizer {
    private static final Logger logger = LoggerFactory.getLogger(JapaneseMorphemizer.class);

    public static final String NAME = "JapaneseMorphemizer";

    private final JapaneseAnalyzer analyzer;

    public JapaneseMorphemizer(JapaneseAnalyzer analyzer) {
        this(analyzer, Constants.MORPHEME_CACHE_CAPACITY);
    }

    public JapaneseMorphemizer(JapaneseAnalyzer analyzer, int cacheCapacity) {
        super(cacheCapacity);
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    @Override
    protected List<Morpheme> computeMorphemes(String expression) {
        // 其他插件可能插入半角空格，会破坏解析结果
        String cleaned = expression.indexOf(' ') >= 0 ? expression.replace(" ", "") : expression;
        if (cleaned.isEmpty()) {
            return List.of();
        }
        try {
            return analyzer.analyze(cleaned);
        } catch (AnalyzerException analyzerException) {
            throw analyzerException;
        } catch (RuntimeException exception) {
            throw new AnalyzerException(NAME, "日语解析失败", exception);
        }
    }

    @Override
    public String getDescription() {
        String identity;
        try {
            identity = analyzer.identity();
        } catch (RuntimeException exception) {
            logger.warn("无法获取日语解析器标识: {}", exception.getMessage());
            identity = Constants.UNAVAILABLE;
        }
        return "Japanese " + identity;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
