package com.morphemizer.analyzer;

import com.morphemizer.morph.Morpheme;

import java.util.List;

/**
 * 日语形态素解析服务。
 */
public interface JapaneseAnalyzer {

    /**
     * 解析未分词的日语文本，按出现顺序返回词素。
     *
     * @throws AnalyzerException 解析服务不可用或出错时抛出
     */
    List<Morpheme> analyze(String text);

    /**
     * 返回解析器的版本/构建标识，可能失败。
     */
    String identity();
}
