package com.phillippitts.enhancer.domain;

/**
 * Output dimensions of an enhancement.
 *
 * @param width  target width in pixels
 * @param height target height in pixels
 */
public record TargetSpec(int width, int height) {

    public static final TargetSpec HD = new TargetSpec(1920, 1080);
    public static final TargetSpec UHD_4K = new TargetSpec(3840, 2160);

    public TargetSpec {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target dimensions must be positive, got: "
                    + width + "x" + height);
        }
    }

    /** Target for a custom upscale: source dimensions times the factor. */
    public static TargetSpec scaled(int sourceWidth, int sourceHeight, int factor) {
        return new TargetSpec(Math.multiplyExact(sourceWidth, factor), Math.multiplyExact(sourceHeight, factor));
    }

    /**
     * Fixed target for the operation, or {@code null} when the target derives from the source.
     */
    public static TargetSpec fixedFor(Operation operation) {
        return switch (operation) {
            case TO_HD -> HD;
            case TO_4K, TO_4K_COMPRESSED -> UHD_4K;
            default -> null;
        };
    }

    public double aspect() {
        return (double) width / height;
    }

    /** @return true if a source of the given size covers this target on both axes */
    public boolean isCoveredBy(int sourceWidth, int sourceHeight) {
        return sourceWidth >= width && sourceHeight >= height;
    }

    /** {@code max(tw/w, th/h)} for the given source. */
    public double maxScaleFrom(int sourceWidth, int sourceHeight) {
        return Math.max((double) width / sourceWidth, (double) height / sourceHeight);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
