package com.morphemizer.morph;

import com.morphemizer.config.Constants;
import com.morphemizer.text.CjkCharacters;

import java.util.ArrayList;
import java.util.List;

/**
 * 逐字切分并只保留中日韩表意文字。
 */
public class CjkCharMorphemizer extends Morphemizer {

    public static final String NAME = "CjkCharMorphemizer";

    public CjkCharMorphemizer() {
        super();
    }

    public CjkCharMorphemizer(int cacheCapacity) {
        super(cacheCapacity);
    }

    @Override
    protected List<Morpheme> computeMorphemes(String expression) {
        List<Morpheme> morphemes = new ArrayList<>();
        expression.codePoints()
            .filter(CjkCharacters::isIdeograph)
            .forEach(codePoint -> morphemes.add(
                Morpheme.ofSurface(Character.toString(codePoint), Constants.CJK_CHAR_TAG, Constants.UNKNOWN_TAG)));
        return morphemes;
    }

    @Override
    public String getDescription() {
        return "CJK Characters";
    }

    @Override
    public String getName() {
        return NAME;
    }
}
