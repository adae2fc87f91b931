package com.transferengine.providers;

/**
 * Failure of one upstream rate source. Never escapes the provider: it moves the
 * resolution on to the next source.
 */
public class RateSourceException extends RuntimeException {

    private final String sourceName;

    public RateSourceException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public RateSourceException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
