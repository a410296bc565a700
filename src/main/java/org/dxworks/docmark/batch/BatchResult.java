package org.dxworks.docmark.batch;

import org.dxworks.docmark.ConversionException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BatchResult {

    private final Map<Path, Path> outputs = new LinkedHashMap<>();
    private final Map<Path, ConversionException> failures = new LinkedHashMap<>();
    private final List<Path> skipped = new ArrayList<>();

    synchronized void addOutput(Path input, Path output) {
        outputs.put(input, output);
    }

    synchronized void addFailure(Path input, ConversionException error) {
        failures.put(input, error);
    }

    synchronized void addSkipped(Path input) {
        skipped.add(input);
    }

    /** Input to output path, in completion order. */
    public synchronized Map<Path, Path> getOutputs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public synchronized Map<Path, ConversionException> getFailures() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /** Inputs never started because the batch was cancelled. */
    public synchronized List<Path> getSkipped() {
        return List.copyOf(skipped);
    }

    public synchronized int getSuccessCount() {
        return outputs.size();
    }

    public synchronized int getFailureCount() {
        return failures.size();
    }

    public synchronized boolean hasFailures() {
        return !failures.isEmpty();
    }
}
