package org.dxworks.docmark.export;

/**
 * Picture pulled out of a document during export, referenced from the
 * Markdown as {@code ![fileName](fileName)}.
 */
public class ExtractedImage {
    public final String fileName;
    public final byte[] data;

    public ExtractedImage(String fileName, byte[] data) {
        this.fileName = fileName;
        this.data = data;
    }
}
