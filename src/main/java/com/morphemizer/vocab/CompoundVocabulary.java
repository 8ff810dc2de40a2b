package com.morphemizer.vocab;

import com.morphemizer.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 含空格的多词词条，按长度降序排列，并附带以连接符替换空格后的平行列表。
 *
 * <p>长度相同的词条保持在词频表中的原始顺序。
 */
public final class CompoundVocabulary {
    private static final Logger logger = LoggerFactory.getLogger(CompoundVocabulary.class);
    private static final CompoundVocabulary EMPTY = new CompoundVocabulary(List.of(), List.of());
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final List<String> phrases;
    private final List<String> joinedPhrases;

    private CompoundVocabulary(List<String> phrases, List<String> joinedPhrases) {
        this.phrases = phrases;
        this.joinedPhrases = joinedPhrases;
    }

    public static CompoundVocabulary empty() {
        return EMPTY;
    }

    /**
     * 从候选词条构建，丢弃内部不含空格的词条并去重。
     */
    public static CompoundVocabulary of(Collection<String> entries) {
        Set<String> unique = new LinkedHashSet<>();
        for (String entry : entries) {
            if (entry != null && hasInteriorSpace(entry)) {
                unique.add(entry);
            }
        }
        if (unique.isEmpty()) {
            return EMPTY;
        }

        List<String> sorted = new ArrayList<>(unique);
        sorted.sort(Comparator.comparingInt(CompoundVocabulary::codePointLength).reversed());

        List<String> joined = new ArrayList<>(sorted.size());
        for (String phrase : sorted) {
            joined.add(phrase.replace(" ", Constants.COMPOUND_JOINER));
        }
        return new CompoundVocabulary(List.copyOf(sorted), List.copyOf(joined));
    }

    /**
     * 读取制表符分隔的词频表，每行第一列为词条。
     *
     * <p>首行首列为 {@link Constants#FREQUENCY_HEADER_SENTINEL} 时该表不适用，返回空词表。
     *
     * @throws VocabularyLoadException 文件缺失、不可读、为空或含空行
     */
    public static CompoundVocabulary load(Path frequencyList) {
        List<String> lines;
        try {
            lines = Files.readAllLines(frequencyList, StandardCharsets.UTF_8);
        } catch (NoSuchFileException noSuchFileException) {
            throw new VocabularyLoadException(frequencyList, "词频表不存在", noSuchFileException);
        } catch (IOException ioException) {
            throw new VocabularyLoadException(frequencyList, "读取词频表失败", ioException);
        }

        if (lines.isEmpty()) {
            throw new VocabularyLoadException(frequencyList, "词频表为空");
        }
        String firstLine = lines.get(0);
        if (!firstLine.isEmpty() && firstLine.charAt(0) == BYTE_ORDER_MARK) {
            lines.set(0, firstLine.substring(1));
        }

        List<String> entries = new ArrayList<>(lines.size());
        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            String line = lines.get(lineIndex);
            if (line.isEmpty()) {
                throw new VocabularyLoadException(frequencyList, "第 " + (lineIndex + 1) + " 行缺少词条列");
            }
            entries.add(firstColumn(line));
        }

        if (Constants.FREQUENCY_HEADER_SENTINEL.equals(entries.get(0))) {
            logger.debug("词频表为学习计划格式，已忽略: {}", frequencyList);
            return EMPTY;
        }

        CompoundVocabulary vocabulary = of(entries);
        logger.debug("从 {} 行词频表中载入 {} 个复合词: {}", entries.size(), vocabulary.size(), frequencyList);
        return vocabulary;
    }

    /**
     * 从最长的词条开始，依次把表达式中出现的词条替换为连接形式。
     *
     * <p>每一步都作用于上一步的结果，先替换的长词可能让较短的词条无法再匹配。
     */
    public String joinCompounds(String expression) {
        String working = expression;
        for (int index = 0; index < phrases.size(); index++) {
            working = working.replace(phrases.get(index), joinedPhrases.get(index));
        }
        return working;
    }

    public List<String> phrases() {
        return phrases;
    }

    public List<String> joinedPhrases() {
        return joinedPhrases;
    }

    public int size() {
        return phrases.size();
    }

    public boolean isEmpty() {
        return phrases.isEmpty();
    }

    /**
     * 首尾以外的位置至少有一个空格。
     */
    private static boolean hasInteriorSpace(String entry) {
        int spaceIndex = entry.indexOf(' ', 1);
        return spaceIndex > 0 && spaceIndex < entry.length() - 1;
    }

    /**
     * 取第一列。以引号开头的字段去掉外层引号，字段内的 {@code ""} 还原为 {@code "}；
     * 闭合引号之后到分隔符之前的字符原样保留。未闭合的引号在行尾结束。
     */
    private static String firstColumn(String line) {
        if (line.isEmpty() || line.charAt(0) != Constants.FREQUENCY_QUOTE) {
            int separatorIndex = line.indexOf(Constants.FREQUENCY_COLUMN_SEPARATOR);
            return separatorIndex < 0 ? line : line.substring(0, separatorIndex);
        }

        StringBuilder field = new StringBuilder(line.length());
        boolean insideQuotes = true;
        for (int index = 1; index < line.length(); index++) {
            char ch = line.charAt(index);
            if (!insideQuotes) {
                if (ch == Constants.FREQUENCY_COLUMN_SEPARATOR) {
                    break;
                }
                field.append(ch);
            } else if (ch != Constants.FREQUENCY_QUOTE) {
                field.append(ch);
            } else if (index + 1 < line.length() && line.charAt(index + 1) == Constants.FREQUENCY_QUOTE) {
                field.append(ch);
                index++;
            } else {
                insideQuotes = false;
            }
        }
        return field.toString();
    }

    private static int codePointLength(String text) {
        return text.codePointCount(0, text.length());
    }
}
