package com.phillippitts.enhancer.exception;

/**
 * Base exception for all image-enhancer application errors.
 * Domain exceptions extend this class so the pipeline boundary can classify them by stage.
 */
public class ImageEnhancerException extends RuntimeException {

    public ImageEnhancerException(String message) {
        super(message);
    }

    public ImageEnhancerException(String message, Throwable cause) {
        super(message, cause);
    }

    public ImageEnhancerException(Throwable cause) {
        super(cause);
    }

    /**
     * Pipeline stage the failure belongs to, used in logs and fallback events.
     *
     * @return stage name
     */
    public String stage() {
        return "unclassified";
    }
}
