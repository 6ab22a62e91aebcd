package com.phillippitts.enhancer.domain;

import java.util.Locale;

/** Enhancement operations exposed to the collaborator layer. */
public enum Operation {
    TO_HD("HD Enhancement"),
    TO_4K("4K Enhancement"),
    TO_4K_COMPRESSED("4K Compressed Enhancement"),
    OPTIMIZE("Image Optimization"),
    CONVERT_FORMAT("Format Conversion"),
    CUSTOM_UPSCALE("Custom Upscale");

    private final String displayName;

    Operation(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** @return true when the output size is fixed regardless of the source size */
    public boolean hasFixedTarget() {
        return this == TO_HD || this == TO_4K || this == TO_4K_COMPRESSED;
    }

    /**
     * Parses an operation name, accepting both {@code TO_4K} and {@code to4K} spellings.
     *
     * @param value operation name
     * @return matching operation
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Operation parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operation must not be blank");
        }
        String key = value.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (Operation op : values()) {
            if (op.name().replace("_", "").toLowerCase(Locale.ROOT).equals(key)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + value);
    }
}
