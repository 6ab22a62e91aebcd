package com.phillippitts.enhancer.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationTest {

    @Test
    void parsesEnumAndCamelCaseSpellings() {
        assertThat(Operation.parse("TO_4K")).isEqualTo(Operation.TO_4K);
        assertThat(Operation.parse("to4K")).isEqualTo(Operation.TO_4K);
        assertThat(Operation.parse("to4KCompressed")).isEqualTo(Operation.TO_4K_COMPRESSED);
        assertThat(Operation.parse("toHD")).isEqualTo(Operation.TO_HD);
        assertThat(Operation.parse("convert-format")).isEqualTo(Operation.CONVERT_FORMAT);
        assertThat(Operation.parse("customUpscale")).isEqualTo(Operation.CUSTOM_UPSCALE);
    }

    @Test
    void rejectsUnknownOperation() {
        assertThatThrownBy(() -> Operation.parse("sharpen"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sharpen");
        assertThatThrownBy(() -> Operation.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyResolutionOperationsHaveFixedTargets() {
        assertThat(Operation.TO_HD.hasFixedTarget()).isTrue();
        assertThat(Operation.TO_4K.hasFixedTarget()).isTrue();
        assertThat(Operation.TO_4K_COMPRESSED.hasFixedTarget()).isTrue();
        assertThat(Operation.OPTIMIZE.hasFixedTarget()).isFalse();
        assertThat(Operation.CONVERT_FORMAT.hasFixedTarget()).isFalse();
        assertThat(Operation.CUSTOM_UPSCALE.hasFixedTarget()).isFalse();
    }

    @Test
    void formatParseAcceptsExtensionsAndNames() {
        assertThat(ImageFormat.parse("jpg")).isEqualTo(ImageFormat.JPEG);
        assertThat(ImageFormat.parse("JPEG")).isEqualTo(ImageFormat.JPEG);
        assertThat(ImageFormat.parse(".tif")).isEqualTo(ImageFormat.TIFF);
        assertThat(ImageFormat.parse("webp")).isEqualTo(ImageFormat.WEBP);
        assertThat(ImageFormat.parse("bmp")).isEqualTo(ImageFormat.BMP);
        assertThatThrownBy(() -> ImageFormat.parse("gif"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported format");
    }

    @Test
    void onlyLosslessAlphaCapableFormatsKeepTransparency() {
        assertThat(ImageFormat.PNG.supportsAlpha()).isTrue();
        assertThat(ImageFormat.PNG.isLossy()).isFalse();
        assertThat(ImageFormat.JPEG.supportsAlpha()).isFalse();
        assertThat(ImageFormat.BMP.supportsAlpha()).isFalse();
    }
}
