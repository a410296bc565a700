package org.dxworks.docmark.document;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape and content of a table to create. {@code data} is row-major and may be
 * ragged; missing cells stay empty.
 */
public class TableConfig {
    public int rows;
    public int cols;
    public int width = 9000;
    public List<List<String>> data = new ArrayList<>();

    public TableConfig() {
    }

    public TableConfig(int rows, int cols, List<List<String>> data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }
}
