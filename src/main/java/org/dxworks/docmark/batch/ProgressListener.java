package org.dxworks.docmark.batch;

@FunctionalInterface
public interface ProgressListener {

    /** Called after each finished item; {@code current} counts finished items, starting at 1. */
    void onProgress(int current, int total);

    static ProgressListener none() {
        return (current, total) -> {
        };
    }
}
