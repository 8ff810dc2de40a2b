package com.morphemizer.analyzer;

/**
 * 外部分词/词法分析服务在切分过程中失败。
 */
public class AnalyzerException extends RuntimeException {
    private final String backend;

    public AnalyzerException(String backend, String message, Throwable cause) {
        super(backend + ": " + message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
