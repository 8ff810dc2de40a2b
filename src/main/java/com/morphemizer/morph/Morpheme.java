package com.morphemizer.morph;

import com.morphemizer.config.Constants;

/**
 * 分词结果的最小单位。
 *
 * @param norm      规范形
 * @param base      原形（词典形）
 * @param inflected 表层形
 * @param read      读音
 * @param pos       主词性标签
 * @param subPos    次词性标签
 */
public record Morpheme(
    String norm,
    String base,
    String inflected,
    String read,
    String pos,
    String subPos
) {

    /**
     * 四个文本字段均取同一表层形。
     */
    public static Morpheme ofSurface(String surface, String pos, String subPos) {
        return new Morpheme(surface, surface, surface, surface, pos, subPos);
    }

    public static Morpheme unknown(String surface) {
        return ofSurface(surface, Constants.UNKNOWN_TAG, Constants.UNKNOWN_TAG);
    }

    public Morpheme withBase(String newBase) {
        return new Morpheme(norm, newBase, inflected, read, pos, subPos);
    }
}
