package com.phillippitts.enhancer.presentation.controller;

import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.util.FileSizeFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Result summary returned by {@code POST /api/enhance}.
 */
public record EnhanceResponse(
        boolean success,
        String operation,
        String outputPath,
        String outputSize,
        String method,
        long durationMs,
        String failureReason,
        Instant completedAt
) {

    private static final Logger LOG = LogManager.getLogger(EnhanceResponse.class);

    static EnhanceResponse from(ProcessingResult result) {
        return new EnhanceResponse(
                result.isSuccess(),
                result.operation().displayName(),
                result.output().map(Path::toString).orElse(null),
                result.output().map(EnhanceResponse::sizeOf).orElse(null),
                result.strategy(),
                result.durationMs(),
                result.failureReason(),
                result.completedAt());
    }

    private static String sizeOf(Path p) {
        try {
            return FileSizeFormatter.format(Files.size(p));
        } catch (IOException e) {
            // Output removed between encode and response; report the path without a size
            LOG.warn("Cannot read size of {}: {}", p, e.getMessage());
            return null;
        }
    }
}
