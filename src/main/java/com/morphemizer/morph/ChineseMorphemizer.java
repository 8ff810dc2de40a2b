package com.morphemizer.morph;

import com.morphemizer.analyzer.AnalyzerException;
import com.morphemizer.analyzer.ChineseSegmenter;
import com.morphemizer.analyzer.TaggedWord;
import com.morphemizer.config.Constants;
import com.morphemizer.text.CjkCharacters;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 中文分词：先过滤掉非汉字，再交给外部词性分词器。
 */
public class ChineseMorphemizer extends Morphemizer {

    public static final String NAME = "ChineseMorphemizer";

    private final ChineseSegmenter segmenter;

    public ChineseMorphemizer(ChineseSegmenter segmenter) {
        this(segmenter, Constants.MORPHEME_CACHE_CAPACITY);
    }

    public ChineseMorphemizer(ChineseSegmenter segmenter, int cacheCapacity) {
        super(cacheCapacity);
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
    }

    @Override
    protected List<Morpheme> computeMorphemes(String expression) {
        String ideographs = CjkCharacters.retainIdeographs(expression);
        if (ideographs.isEmpty()) {
            return List.of();
        }

        List<TaggedWord> words;
        try {
            words = segmenter.cut(ideographs);
        } catch (AnalyzerException analyzerException) {
            throw analyzerException;
        } catch (RuntimeException exception) {
            throw new AnalyzerException(NAME, "中文分词失败", exception);
        }

        List<Morpheme> morphemes = new ArrayList<>(words.size());
        for (TaggedWord word : words) {
            morphemes.add(Morpheme.ofSurface(word.word(), word.flag(), Constants.UNKNOWN_TAG));
        }
        return morphemes;
    }

    @Override
    public String getDescription() {
        return "Chinese";
    }

    @Override
    public String getName() {
        return NAME;
    }
}
