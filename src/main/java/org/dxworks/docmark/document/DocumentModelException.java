package org.dxworks.docmark.document;

/**
 * Raised when the document model rejects a mutation (bad table shape,
 * unreadable picture, invalid equation markup).
 */
public class DocumentModelException extends Exception {

    private final String operation;

    public DocumentModelException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public DocumentModelException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
