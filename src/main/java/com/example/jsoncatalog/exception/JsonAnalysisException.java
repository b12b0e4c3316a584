package com.example.jsoncatalog.exception;

import lombok.Getter;

/**
 * Malformed JSON input. Line and column are 1-based, or -1 when the parser did not report them.
 */
@Getter
public class JsonAnalysisException extends RuntimeException {

    private final String source;
    private final int line;
    private final int column;

    public JsonAnalysisException(String source, int line, int column, String detail, Throwable cause) {
        super(buildMessage(source, line, column, detail), cause);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    private static String buildMessage(String source, int line, int column, String detail) {
        StringBuilder sb = new StringBuilder("Invalid JSON syntax in file: ").append(source);
        if (line > 0) {
            sb.append(" (line ").append(line).append(", column ").append(column).append(')');
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
