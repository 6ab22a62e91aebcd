package com.phillippitts.enhancer.domain;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one enhancement call, built by the collaborator layer per user
 * action.
 *
 * @param source       path of the decoded source file
 * @param operation    requested operation
 * @param targetFormat output encoding for {@link Operation#CONVERT_FORMAT}, otherwise null
 * @param scaleFactor  one of {@link #SUPPORTED_SCALE_FACTORS} for {@link Operation#CUSTOM_UPSCALE},
 *                     otherwise 1
 * @param mode         upscale mode; {@link UpscaleMode#STANDARD} when not applicable
 * @param requester    opaque caller id used by activity hooks, may be null
 */
public record EnhancementRequest(
        Path source,
        Operation operation,
        ImageFormat targetFormat,
        int scaleFactor,
        UpscaleMode mode,
        String requester
) {

    /** Factors offered for custom upscale. */
    public static final Set<Integer> SUPPORTED_SCALE_FACTORS = Set.of(2, 3, 4, 8);

    public EnhancementRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(operation, "operation");
        if (scaleFactor <= 0) {
            throw new IllegalArgumentException("Scale factor must be a positive integer, got: " + scaleFactor);
        }
        if (operation == Operation.CUSTOM_UPSCALE && !SUPPORTED_SCALE_FACTORS.contains(scaleFactor)) {
            throw new IllegalArgumentException("Scale factor must be one of 2, 3, 4 or 8, got: " + scaleFactor);
        }
        mode = mode == null ? UpscaleMode.STANDARD : mode;
        if (operation == Operation.CONVERT_FORMAT && targetFormat == null) {
            throw new IllegalArgumentException("Format conversion requires a target format");
        }
    }

    public static EnhancementRequest of(Path source, Operation operation) {
        if (operation == Operation.CONVERT_FORMAT || operation == Operation.CUSTOM_UPSCALE) {
            throw new IllegalArgumentException(operation + " needs parameters; use the dedicated factory");
        }
        return new EnhancementRequest(source, operation, null, 1, UpscaleMode.STANDARD, null);
    }

    public static EnhancementRequest convert(Path source, ImageFormat targetFormat) {
        return new EnhancementRequest(source, Operation.CONVERT_FORMAT, targetFormat, 1, UpscaleMode.STANDARD, null);
    }

    public static EnhancementRequest customUpscale(Path source, int scaleFactor, UpscaleMode mode) {
        return new EnhancementRequest(source, Operation.CUSTOM_UPSCALE, null, scaleFactor, mode, null);
    }

    /** Custom upscale from a menu option such as {@code 4x}, {@code smart} or {@code max}. */
    public static EnhancementRequest customUpscale(Path source, UpscaleOption option) {
        return customUpscale(source, option.scaleFactor(), option.mode());
    }

    /** Copy of this request attributed to the given caller. */
    public EnhancementRequest withRequester(String requesterId) {
        return new EnhancementRequest(source, operation, targetFormat, scaleFactor, mode, requesterId);
    }

    /** File name of the source without its extension. */
    public String sourceBaseName() {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
