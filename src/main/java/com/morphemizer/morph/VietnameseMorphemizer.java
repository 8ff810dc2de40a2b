package com.morphemizer.morph;

import com.morphemizer.config.Constants;
import com.morphemizer.config.Preferences;
import com.morphemizer.vocab.CompoundVocabulary;
import com.morphemizer.vocab.VocabularyLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 越南语中大量复合词的音节之间以空格分隔，借助词频表中的多词词条识别复合词。
 *
 * <p>词表只在构造时载入一次；载入失败时退化为普通的空格分词。
 */
public class VietnameseMorphemizer extends Morphemizer {
    private static final Logger logger = LoggerFactory.getLogger(VietnameseMorphemizer.class);

    public static final String NAME = "VietnameseMorphemizer";

    private final CompoundVocabulary vocabulary;

    public VietnameseMorphemizer(Preferences preferences) {
        this(preferences, Constants.MORPHEME_CACHE_CAPACITY);
    }

    public VietnameseMorphemizer(Preferences preferences, int cacheCapacity) {
        this(loadVocabulary(preferences), cacheCapacity);
    }

    public VietnameseMorphemizer(CompoundVocabulary vocabulary, int cacheCapacity) {
        super(cacheCapacity);
        this.vocabulary = vocabulary == null ? CompoundVocabulary.empty() : vocabulary;
    }

    @Override
    protected List<Morpheme> computeMorphemes(String expression) {
        String joined = vocabulary.joinCompounds(expression.toLowerCase(Locale.ROOT));

        List<Morpheme> tokens = SpaceMorphemizer.splitWords(joined);
        List<Morpheme> morphemes = new ArrayList<>(tokens.size());
        for (Morpheme token : tokens) {
            // 只还原原形中的空格，其余字段保留连接符
            morphemes.add(token.withBase(token.base().replace(Constants.COMPOUND_JOINER, " ")));
        }
        return morphemes;
    }

    public CompoundVocabulary getVocabulary() {
        return vocabulary;
    }

    @Override
    public String getDescription() {
        return "Vietnamese";
    }

    @Override
    public String getName() {
        return NAME;
    }

    private static CompoundVocabulary loadVocabulary(Preferences preferences) {
        Optional<String> configuredPath = preferences == null
            ? Optional.empty()
            : preferences.getPreference(Constants.PREF_PATH_FREQUENCY);
        if (configuredPath.isEmpty() || configuredPath.get().isBlank()) {
            logger.debug("未配置 {}，越南语复合词表为空", Constants.PREF_PATH_FREQUENCY);
            return CompoundVocabulary.empty();
        }

        try {
            return CompoundVocabulary.load(Path.of(configuredPath.get()));
        } catch (VocabularyLoadException loadException) {
            logger.warn("越南语复合词表载入失败，退化为空格分词: {}", loadException.getMessage());
        } catch (InvalidPathException invalidPathException) {
            logger.warn("越南语词频表路径非法，退化为空格分词: {}", invalidPathException.getMessage());
        }
        return CompoundVocabulary.empty();
    }
}
