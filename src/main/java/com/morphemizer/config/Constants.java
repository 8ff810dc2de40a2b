package com.morphemizer.config;

/**
 * 全局常量定义
 * 
 * 包含缓存容量、词频表格式约定和偏好设置键名
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 缓存参数 ====================
    /** 每个分词器的记忆化缓存容量（LRU） */
    public static final int MORPHEME_CACHE_CAPACITY = 131_072;
    
    // ==================== 词形标签 ====================
    /** 无法确定词性时使用的占位标签 */
    public static final String UNKNOWN_TAG = "UNKNOWN";
    /** 单个CJK汉字的主标签 */
    public static final String CJK_CHAR_TAG = "CJK_CHAR";
    /** 外部服务不可用时描述中使用的占位值 */
    public static final String UNAVAILABLE = "UNAVAILABLE";
    
    // ==================== 越南语词频表 ====================
    /** 首行首列为此值时整张词频表被忽略 */
    public static final String FREQUENCY_HEADER_SENTINEL = "#study_plan_frequency";
    /** 词频表列分隔符 */
    public static final char FREQUENCY_COLUMN_SEPARATOR = '\t';
    /** 词频表字段引号 */
    public static final char FREQUENCY_QUOTE = '"';
    /** 复合词内部空格的替换连接符 */
    public static final String COMPOUND_JOINER = "_";
    
    // ==================== 偏好设置 ====================
    /** 越南语词频表路径的偏好键 */
    public static final String PREF_PATH_FREQUENCY = "path_frequency";
    /** 默认偏好设置文件名 */
    public static final String DEFAULT_PREFERENCES_FILE = "morphemizer.json";
}
