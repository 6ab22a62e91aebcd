package com.phillippitts.enhancer.service.resample;

/**
 * Keys cubic convolution kernel over a 4-tap (4x4 in 2D) neighbourhood.
 */
public final class BicubicKernel implements ResamplingKernel {

    /** Same sharpness parameter as common cubic interpolation in computer-vision libraries. */
    public static final double DEFAULT_A = -0.75;

    private final double a;

    public BicubicKernel(double a) {
        this.a = a;
    }

    @Override
    public String name() {
        return "bicubic";
    }

    @Override
    public double radius() {
        return 2.0;
    }

    @Override
    public double weight(double x) {
        double ax = Math.abs(x);
        if (ax < 1.0) {
            return ((a + 2.0) * ax - (a + 3.0)) * ax * ax + 1.0;
        }
        if (ax < 2.0) {
            return ((a * ax - 5.0 * a) * ax + 8.0 * a) * ax - 4.0 * a;
        }
        return 0.0;
    }
}
