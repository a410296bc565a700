package org.dxworks.docmark;

public enum ErrorCategory {
    /** Input could not be parsed at all; never recoverable. */
    PARSE("parse"),
    UNSUPPORTED_NODE("unsupported_node"),
    DOCUMENT_MODEL("document_model"),
    IO("io");

    private final String name;

    ErrorCategory(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
