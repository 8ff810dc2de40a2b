package com.morphemizer.analyzer;

import java.util.List;

/**
 * 中文分词与词性标注服务。
 */
public interface ChineseSegmenter {

    /**
     * 将纯汉字文本切分为 (词, 词性) 序列。
     *
     * @throws AnalyzerException 分词服务出错时抛出
     */
    List<TaggedWord> cut(String text);
}
