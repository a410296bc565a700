package org.dxworks.docmark.batch;

import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.ErrorCategory;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one conversion per input file. With a parallelism of one the items run
 * in input order on the calling thread; otherwise on a fixed pool, with
 * progress reported from the calling thread in completion order.
 * <p>
 * Failures are reported to the error callback by the item converter itself.
 * When errors are not ignored the first failure cancels the remaining work
 * and is rethrown.
 */
public class BatchRunner {

    @FunctionalInterface
    public interface ItemConverter {
        /** Converts one input and returns the path written. */
        Path convert(Path input) throws ConversionException;
    }

    private final int parallelism;
    private final boolean ignoreErrors;
    private final ProgressListener progress;
    private final Logger logger;

    public BatchRunner(int parallelism, boolean ignoreErrors, ProgressListener progress, Logger logger) {
        this.parallelism = Math.max(1, parallelism);
        this.ignoreErrors = ignoreErrors;
        this.progress = progress != null ? progress : ProgressListener.none();
        this.logger = logger;
    }

    public BatchResult run(List<Path> inputs, ItemConverter converter, CancellationToken token)
            throws ConversionException {
        CancellationToken effectiveToken = token != null ? token : new CancellationToken();
        logger.info("Batch of {} file(s), parallelism {}", inputs.size(), parallelism);
        if (parallelism == 1 || inputs.size() <= 1) {
            return runSequential(inputs, converter, effectiveToken);
        }
        return runParallel(inputs, converter, effectiveToken);
    }

    private BatchResult runSequential(List<Path> inputs, ItemConverter converter, CancellationToken token)
            throws ConversionException {
        BatchResult result = new BatchResult();
        int total = inputs.size();
        int finished = 0;
        for (Path input : inputs) {
            if (token.isCancelled()) {
                result.addSkipped(input);
                continue;
            }
            try {
                result.addOutput(input, converter.convert(input));
            } catch (ConversionException e) {
                result.addFailure(input, e);
                logger.warn("Failed to convert {}: {}", input, e.getMessage());
                if (!ignoreErrors) {
                    throw e;
                }
            }
            progress.onProgress(++finished, total);
        }
        return result;
    }

    private BatchResult runParallel(List<Path> inputs, ItemConverter converter, CancellationToken token)
            throws ConversionException {
        BatchResult result = new BatchResult();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, inputs.size()));
        CompletionService<Path> completion = new ExecutorCompletionService<>(executor);
        List<Future<Path>> futures = new ArrayList<>();
        List<Path> submitted = new ArrayList<>();

        try {
            for (Path input : inputs) {
                futures.add(completion.submit(() -> {
                    if (token.isCancelled()) {
                        return null;
                    }
                    result.addOutput(input, converter.convert(input));
                    return input;
                }));
                submitted.add(input);
            }

            int total = inputs.size();
            int finished = 0;
            for (int i = 0; i < futures.size(); i++) {
                Future<Path> done = completion.take();
                Path input = submitted.get(futures.indexOf(done));
                try {
                    if (done.get() == null) {
                        result.addSkipped(input);
                        continue;
                    }
                } catch (ExecutionException e) {
                    ConversionException error = unwrap(input, e.getCause());
                    result.addFailure(input, error);
                    logger.warn("Failed to convert {}: {}", input, error.getMessage());
                    if (!ignoreErrors) {
                        token.cancel();
                        futures.forEach(f -> f.cancel(true));
                        throw error;
                    }
                }
                progress.onProgress(++finished, total);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            futures.forEach(f -> f.cancel(true));
            throw new ConversionException(ErrorCategory.IO, "Batch", "interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static ConversionException unwrap(Path input, Throwable cause) {
        if (cause instanceof ConversionException conversionException) {
            return conversionException;
        }
        return new ConversionException(ErrorCategory.IO, "Batch", "unexpected failure for " + input, cause);
    }
}
