package com.morphemizer.analyzer;

import com.hankcs.hanlp.HanLP;
import com.hankcs.hanlp.seg.common.Term;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 HanLP 标准分词器的中文词性切分。
 */
public class HanLpChineseSegmenter implements ChineseSegmenter {

    static final String BACKEND = "hanlp";

    @Override
    public List<TaggedWord> cut(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Term> terms;
        try {
            terms = HanLP.segment(text);
        } catch (RuntimeException exception) {
            throw new AnalyzerException(BACKEND, "分词失败: " + exception.getMessage(), exception);
        }

        List<TaggedWord> words = new ArrayList<>(terms.size());
        for (Term term : terms) {
            String flag = term.nature == null ? "x" : term.nature.toString();
            words.add(new TaggedWord(term.word, flag));
        }
        return words;
    }
}
