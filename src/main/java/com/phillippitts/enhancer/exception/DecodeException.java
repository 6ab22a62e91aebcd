package com.phillippitts.enhancer.exception;

import java.nio.file.Path;

/**
 * Thrown when a source file cannot be decoded by either the primary or the alternate decoder,
 * or when it is missing or exceeds the configured size limit.
 */
public class DecodeException extends ImageEnhancerException {

    private final Path source;

    public DecodeException(Path source, String reason) {
        super("Cannot decode " + fileName(source) + ": " + reason);
        this.source = source;
    }

    public DecodeException(Path source, String reason, Throwable cause) {
        super("Cannot decode " + fileName(source) + ": " + reason, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }

    @Override
    public String stage() {
        return "decode";
    }

    private static String fileName(Path p) {
        return p == null || p.getFileName() == null ? "<none>" : p.getFileName().toString();
    }
}
