package com.phillippitts.enhancer.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * JSON body of {@code POST /api/enhance}.
 *
 * @param source      local path of the already-downloaded source file
 * @param operation   {@code toHD}, {@code to4K}, {@code to4KCompressed}, {@code optimize},
 *                    {@code convertFormat} or {@code customUpscale}
 * @param format      target format for conversion
 * @param option      custom upscale menu option ({@code 2x}, {@code smart}, {@code max}, ...)
 * @param scaleFactor explicit custom upscale factor, overrides the option's factor
 * @param mode        explicit custom upscale mode, overrides the option's mode
 * @param requester   caller id for the activity log
 */
public record EnhanceRequestBody(
        @NotBlank String source,
        @NotBlank String operation,
        String format,
        String option,
        @Positive Integer scaleFactor,
        String mode,
        String requester
) {
}
