package com.morphemizer.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 只读的偏好设置视图，键值均为字符串。
 */
public final class Preferences {
    private static final Logger logger = LoggerFactory.getLogger(Preferences.class);
    private static final Preferences EMPTY = new Preferences(Map.of());

    private final Map<String, String> values;

    private Preferences(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static Preferences empty() {
        return EMPTY;
    }

    public static Preferences of(Map<String, String> values) {
        return values == null || values.isEmpty() ? EMPTY : new Preferences(values);
    }

    /**
     * 从JSON对象文件读取偏好设置，文件不存在时返回空设置。
     */
    public static Preferences load(Path preferencesFile) {
        if (preferencesFile == null || !Files.isRegularFile(preferencesFile)) {
            logger.debug("偏好设置文件不存在: {}", preferencesFile);
            return EMPTY;
        }
        try {
            JsonNode root = new ObjectMapper().readTree(preferencesFile.toFile());
            if (root == null || !root.isObject()) {
                throw new IllegalStateException("偏好设置文件必须是JSON对象: " + preferencesFile);
            }
            Map<String, String> loaded = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isNull()) {
                    loaded.put(field.getKey(), field.getValue().asText());
                }
            }
            return of(loaded);
        } catch (IOException ioException) {
            throw new IllegalStateException("读取偏好设置失败: " + preferencesFile, ioException);
        }
    }

    public Optional<String> getPreference(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 返回覆盖了单个键的新实例。
     */
    public Preferences with(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(values);
        merged.put(key, value);
        return new Preferences(merged);
    }

    public Map<String, String> asMap() {
        return values;
    }
}
