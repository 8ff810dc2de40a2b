package com.morphemizer.vocab;

import java.nio.file.Path;

/**
 * 词频表缺失、不可读或格式错误。
 */
public class VocabularyLoadException extends RuntimeException {
    private final Path path;

    public VocabularyLoadException(Path path, String message) {
        this(path, message, null);
    }

    public VocabularyLoadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
