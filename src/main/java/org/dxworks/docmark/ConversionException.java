package org.dxworks.docmark;

/**
 * Failure of a conversion call or of a single element within it.
 * Line and column are 1-based and zero when unknown.
 */
public class ConversionException extends Exception {

    private final ErrorCategory category;
    private final String operation;
    private final String detail;
    private final int line;
    private final int column;

    public ConversionException(ErrorCategory category, String operation, String detail) {
        this(category, operation, detail, 0, 0, null);
    }

    public ConversionException(ErrorCategory category, String operation, String detail, Throwable cause) {
        this(category, operation, detail, 0, 0, cause);
    }

    public ConversionException(ErrorCategory category, String operation, String detail,
                               int line, int column, Throwable cause) {
        super(format(operation, detail, line, column), cause);
        this.category = category;
        this.operation = operation;
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getOperation() {
        return operation;
    }

    /** The message without operation and position. */
    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return line > 0;
    }

    private static String format(String operation, String detail, int line, int column) {
        if (line > 0) {
            return operation + " at line " + line + ", column " + column + ": " + detail;
        }
        return operation + ": " + detail;
    }
}
