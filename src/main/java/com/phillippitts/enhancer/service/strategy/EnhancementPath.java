package com.phillippitts.enhancer.service.strategy;

/** Algorithm path chosen for one enhancement call. */
public enum EnhancementPath {
    /** Source covers the target: centred crop to the target aspect, Lanczos, sharpness 1.1. */
    SMART_RESIZE,
    /** Extreme stretch for HD/4K: one Lanczos resample, sharpness 1.2, no progressive steps. */
    SINGLE_STEP_HQ,
    /** HD: bilateral denoise, bicubic, 3x3 sharpen blend. */
    DENOISE_SHARPEN,
    /** 4K: progressive bicubic with denoise, then unsharp mask. */
    PROGRESSIVE_4K,
    /** 4K compressed: one Lanczos resample, sharpness 1.1. */
    COMPRESSED,
    /** 4K compressed beyond 10x: Lanczos to an intermediate size first. */
    COMPRESSED_INTERMEDIATE,
    /** Custom smart up to 4x: one Lanczos resample, sharpness 1.1. */
    SMART_SINGLE,
    /** Custom smart beyond 4x: progressive Lanczos, sharpness 1.1. */
    SMART_PROGRESSIVE,
    /** Custom max: bilateral denoise, bicubic, strong unsharp mask. */
    MAX_QUALITY,
    /** Custom standard: one Lanczos resample, no filtering. */
    STANDARD,
    /** Fit within the optimize bound, sharpness 1.1. */
    OPTIMIZE,
    /** Re-encode only. */
    CONVERT
}
