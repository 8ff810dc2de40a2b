package com.morphemizer.morph;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 以空格分词的语言（英语、德语、西班牙语等）。无法从屈折形推出原形。
 */
public class SpaceMorphemizer extends Morphemizer {

    public static final String NAME = "SpaceMorphemizer";

    // 单词字符另含 No 类（², ½）
    private static final String WORD_CHAR = "[\\w\\p{No}]";
    private static final String WORD_BOUNDARY =
        "(?:(?<=" + WORD_CHAR + ")(?!" + WORD_CHAR + ")|(?<!" + WORD_CHAR + ")(?=" + WORD_CHAR + "))";

    // 整段不含数字的单词；含数字的词整体跳过而不是截断
    private static final Pattern WORD_PATTERN =
        Pattern.compile(WORD_BOUNDARY + "[^\\s\\d]+" + WORD_BOUNDARY, Pattern.UNICODE_CHARACTER_CLASS);

    public SpaceMorphemizer() {
        super();
    }

    public SpaceMorphemizer(int cacheCapacity) {
        super(cacheCapacity);
    }

    @Override
    protected List<Morpheme> computeMorphemes(String expression) {
        return splitWords(expression);
    }

    /**
     * 不经缓存的空格切分，供其他分词器复用。
     */
    static List<Morpheme> splitWords(String expression) {
        if (expression == null || expression.isEmpty()) {
            return List.of();
        }

        List<Morpheme> morphemes = new ArrayList<>();
        Matcher wordMatcher = WORD_PATTERN.matcher(expression);
        while (wordMatcher.find()) {
            String word = wordMatcher.group().toLowerCase(Locale.ROOT);
            morphemes.add(Morpheme.unknown(word));
        }
        return morphemes;
    }

    @Override
    public String getDescription() {
        return "Language w/ Spaces";
    }

    @Override
    public String getName() {
        return NAME;
    }
}
