package com.phillippitts.enhancer.exception;

import com.phillippitts.enhancer.domain.ImageFormat;

/**
 * Thrown when an output cannot be written: no writer for the format, an unsupported
 * channel/format pairing, or an I/O failure on the target path.
 */
public class EncodeException extends ImageEnhancerException {

    private final ImageFormat format;

    public EncodeException(ImageFormat format, String reason) {
        super("Cannot encode " + format + ": " + reason);
        this.format = format;
    }

    public EncodeException(ImageFormat format, String reason, Throwable cause) {
        super("Cannot encode " + format + ": " + reason, cause);
        this.format = format;
    }

    public ImageFormat getFormat() {
        return format;
    }

    @Override
    public String stage() {
        return "encode";
    }
}
