package com.phillippitts.enhancer.exception;

/**
 * Thrown before any pixel work when the planned output raster exceeds
 * {@code enhancer.max-output-pixels}.
 */
public class OutputTooLargeException extends ImageEnhancerException {

    private final int width;
    private final int height;
    private final long limit;

    public OutputTooLargeException(int width, int height, long limit) {
        super("Output " + width + "x" + height + " (" + ((long) width * height)
                + " px) exceeds the limit of " + limit + " px");
        this.width = width;
        this.height = height;
        this.limit = limit;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getLimit() {
        return limit;
    }

    @Override
    public String stage() {
        return "limit";
    }
}
