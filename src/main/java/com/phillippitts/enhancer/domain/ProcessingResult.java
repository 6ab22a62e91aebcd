package com.phillippitts.enhancer.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one enhancement call: an output file on success, a failure marker otherwise.
 *
 * <p>Callers observe success or failure only through this value; the core never throws past
 * its entry points.
 *
 * @param operation     operation that was requested
 * @param outputPath    written file, null on failure
 * @param strategy      name of the strategy that produced the output, or that failed last
 * @param durationMs    wall time spent on the call
 * @param failureReason short reason on failure, null on success
 * @param completedAt   completion time
 */
public record ProcessingResult(
        Operation operation,
        Path outputPath,
        String strategy,
        long durationMs,
        String failureReason,
        Instant completedAt
) {

    public ProcessingResult {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(completedAt, "completedAt");
        if (outputPath == null && (failureReason == null || failureReason.isBlank())) {
            throw new IllegalArgumentException("Failed result must carry a reason");
        }
    }

    public static ProcessingResult success(Operation operation, Path outputPath, String strategy, long durationMs) {
        Objects.requireNonNull(outputPath, "outputPath");
        return new ProcessingResult(operation, outputPath, strategy, durationMs, null, Instant.now());
    }

    public static ProcessingResult failure(Operation operation, String strategy, String reason, long durationMs) {
        return new ProcessingResult(operation, null, strategy, durationMs, reason, Instant.now());
    }

    public boolean isSuccess() {
        return outputPath != null;
    }

    public Optional<Path> output() {
        return Optional.ofNullable(outputPath);
    }
}
