package com.llmfactory.common.errors;

import lombok.Getter;

/**
 * A definition source could not be read: the location is not a directory,
 * an object could not be fetched, or a file failed to parse.
 */
@Getter
public class ConfigLoadError extends LlmFactoryError {

    /** Offending directory or file. */
    private final String location;
    /** 1-based line of a parse failure, or -1 when unknown. */
    private final int line;
    /** 1-based column of a parse failure, or -1 when unknown. */
    private final int column;

    public ConfigLoadError(String location, String message) {
        this(location, -1, -1, message, null);
    }

    public ConfigLoadError(String location, String message, Throwable cause) {
        this(location, -1, -1, message, cause);
    }

    public ConfigLoadError(String location, int line, int column, String message, Throwable cause) {
        super(format(location, line, column, message), cause);
        this.location = location;
        this.line = line;
        this.column = column;
    }

    private static String format(String location, int line, int column, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(message).append(" [").append(location);
        if (line > 0) {
            sb.append(':').append(line);
            if (column > 0) {
                sb.append(':').append(column);
            }
        }
        return sb.append(']').toString();
    }
}
