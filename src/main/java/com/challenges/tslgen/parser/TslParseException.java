package com.challenges.tslgen.parser;

/**
 * Raised when TSL text cannot be turned into a specification.
 */
public class TslParseException extends RuntimeException {

    public enum ErrorType {
        SYNTAX,
        PROPERTY,
        EXPRESSION,
        CONSTRAINT,
        FILE_SYSTEM
    }

    private final ErrorType type;
    private final int lineNumber;
    private final int columnNumber;
    private final String lineContent;

    public TslParseException(ErrorType type, String message) {
        this(type, message, 0, 0, null, null);
    }

    public TslParseException(ErrorType type, String message, Throwable cause) {
        this(type, message, 0, 0, null, cause);
    }

    public TslParseException(ErrorType type, String message, int lineNumber, int columnNumber, String lineContent) {
        this(type, message, lineNumber, columnNumber, lineContent, null);
    }

    private TslParseException(ErrorType type, String message, int lineNumber, int columnNumber,
                              String lineContent, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.lineContent = lineContent;
    }

    public ErrorType type() {
        return type;
    }

    /** 1-based line, or 0 when unknown. */
    public int lineNumber() {
        return lineNumber;
    }

    /** 1-based column, or 0 when unknown. */
    public int columnNumber() {
        return columnNumber;
    }

    public String lineContent() {
        return lineContent;
    }

    /** Copy of this error pinned to a line of the source, keeping any column already known. */
    TslParseException atLine(int line, int columnOffset, String content) {
        int column = columnNumber > 0 ? columnNumber + columnOffset : 0;
        return new TslParseException(type, super.getMessage(), line, column, content, getCause());
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(type.name().toLowerCase().replace('_', ' '))
                .append(": ")
                .append(super.getMessage());
        if (lineNumber > 0) {
            sb.append(" (line ").append(lineNumber);
            if (columnNumber > 0) {
                sb.append(", column ").append(columnNumber);
            }
            sb.append(')');
        }
        if (lineContent != null) {
            sb.append("\n  | ").append(lineContent);
            if (columnNumber > 0) {
                sb.append("\n  | ").append(" ".repeat(columnNumber - 1)).append('^');
            }
        }
        return sb.toString();
    }
}
