package com.morphemizer.config;

/**
 * 分词运行时配置
 * 
 * 支持从CLI参数或偏好设置文件注入，覆盖Constants默认值
 */
public class MorphConfig {
    private Preferences preferences = Preferences.empty();
    private int cacheCapacity = Constants.MORPHEME_CACHE_CAPACITY;
    
    public Preferences getPreferences() {
        return preferences;
    }
    
    public void setPreferences(Preferences preferences) {
        this.preferences = preferences == null ? Preferences.empty() : preferences;
    }
    
    public int getCacheCapacity() {
        return cacheCapacity;
    }
    
    public void setCacheCapacity(int cacheCapacity) {
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须为正数: " + cacheCapacity);
        }
        this.cacheCapacity = cacheCapacity;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static MorphConfig defaults() {
        return new MorphConfig();
    }
}
