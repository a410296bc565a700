package org.dxworks.docmark.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One line of the JSONL report for a converted file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionRecord {
    public String kind = "converted";
    public String file;
    public String format;
    public String output;
    public Long durationMillis;
}
