package com.morphemizer.text;

/**
 * 中日韩表意文字的码点范围。
 */
public final class CjkCharacters {

    // {起始, 结束}，闭区间，按码点升序
    private static final int[][] IDEOGRAPH_RANGES = {
        {0x3007, 0x3007},   // 〇
        {0x3400, 0x4DBF},   // 扩展A
        {0x4E00, 0x9FFF},   // 基本区
        {0xF900, 0xFAFF},   // 兼容表意文字
        {0x20000, 0x2A6DF}, // 扩展B
        {0x2A700, 0x2B73F}, // 扩展C
        {0x2B740, 0x2B81F}, // 扩展D
        {0x2F800, 0x2FA1F}  // 兼容表意文字补充
    };

    private CjkCharacters() {
    }

    /**
     * 判断码点是否属于CJK表意文字。
     */
    public static boolean isIdeograph(int codePoint) {
        for (int[] range : IDEOGRAPH_RANGES) {
            if (codePoint < range[0]) {
                return false;
            }
            if (codePoint <= range[1]) {
                return true;
            }
        }
        return false;
    }

    /**
     * 只保留表意文字，丢弃标点、拉丁字母与空白。
     */
    public static String retainIdeographs(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder retained = new StringBuilder(text.length());
        text.codePoints()
            .filter(CjkCharacters::isIdeograph)
            .forEach(retained::appendCodePoint);
        return retained.toString();
    }
}
