package com.phillippitts.enhancer.service.resample;

/**
 * One-dimensional interpolation kernel used by {@link Resampler}.
 *
 * <p>The kernel is defined on {@code [-radius, radius]} and must evaluate to {@code 1.0} at
 * {@code x = 0}.
 */
public interface ResamplingKernel {

    /** Cubic convolution, the interpolation used by the pixel pipelines. */
    ResamplingKernel BICUBIC = new BicubicKernel(BicubicKernel.DEFAULT_A);

    /** Three-lobe Lanczos, the high-quality interpolation used by the buffer pipelines. */
    ResamplingKernel LANCZOS = new LanczosKernel(3);

    /** @return short name for logs, e.g. {@code "bicubic"} */
    String name();

    /** @return support radius in source pixels at scale 1 */
    double radius();

    /**
     * Evaluates the kernel.
     *
     * @param x signed distance in source pixels
     * @return weight at {@code x}, zero outside the support
     */
    double weight(double x);
}
