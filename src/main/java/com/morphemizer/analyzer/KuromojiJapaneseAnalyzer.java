package com.morphemizer.analyzer;

import com.atilika.kuromoji.ipadic.Token;
import com.atilika.kuromoji.ipadic.Tokenizer;
import com.morphemizer.morph.Morpheme;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Kuromoji (IPADIC) 的日语解析器，词典在首次使用时加载。
 */
public class KuromojiJapaneseAnalyzer implements JapaneseAnalyzer {

    static final String BACKEND = "kuromoji";
    private static final String MISSING_FIELD = "*";

    private volatile Tokenizer tokenizer;

    @Override
    public List<Morpheme> analyze(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens;
        try {
            tokens = tokenizer().tokenize(text);
        } catch (RuntimeException exception) {
            throw new AnalyzerException(BACKEND, "解析失败: " + exception.getMessage(), exception);
        }

        List<Morpheme> morphemes = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            String surface = token.getSurface();
            morphemes.add(new Morpheme(
                surface,
                orSurface(token.getBaseForm(), surface),
                surface,
                orSurface(token.getReading(), surface),
                token.getPartOfSpeechLevel1(),
                token.getPartOfSpeechLevel2()
            ));
        }
        return morphemes;
    }

    @Override
    public String identity() {
        tokenizer();
        String version = Tokenizer.class.getPackage().getImplementationVersion();
        return version == null ? "Kuromoji (ipadic)" : "Kuromoji " + version + " (ipadic)";
    }

    private Tokenizer tokenizer() {
        Tokenizer current = tokenizer;
        if (current == null) {
            synchronized (this) {
                current = tokenizer;
                if (current == null) {
                    try {
                        current = new Tokenizer();
                    } catch (RuntimeException exception) {
                        throw new AnalyzerException(BACKEND, "词典加载失败", exception);
                    }
                    tokenizer = current;
                }
            }
        }
        return current;
    }

    private static String orSurface(String field, String surface) {
        return field == null || field.isEmpty() || MISSING_FIELD.equals(field) ? surface : field;
    }
}
