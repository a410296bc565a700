package org.dxworks.docmark;

public enum Format {
    MARKDOWN("markdown"),
    DOCX("docx");

    private final String name;

    Format(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
