package com.phillippitts.enhancer.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UpscaleOptionTest {

    @Test
    void explicitFactorsUseStandardMode() {
        assertThat(UpscaleOption.parse("2x")).isEqualTo(new UpscaleOption(2, UpscaleMode.STANDARD));
        assertThat(UpscaleOption.parse("3x")).isEqualTo(new UpscaleOption(3, UpscaleMode.STANDARD));
        assertThat(UpscaleOption.parse("4X")).isEqualTo(new UpscaleOption(4, UpscaleMode.STANDARD));
        assertThat(UpscaleOption.parse(" 8x ")).isEqualTo(new UpscaleOption(8, UpscaleMode.STANDARD));
    }

    @Test
    void namedModesUseTheirDefaultFactor() {
        assertThat(UpscaleOption.parse("smart")).isEqualTo(new UpscaleOption(2, UpscaleMode.SMART));
        assertThat(UpscaleOption.parse("max")).isEqualTo(new UpscaleOption(4, UpscaleMode.MAX));
    }

    @Test
    void unknownOrMissingTokensFallBackToTwoTimesStandard() {
        UpscaleOption expected = new UpscaleOption(2, UpscaleMode.STANDARD);
        assertThat(UpscaleOption.parse(null)).isEqualTo(expected);
        assertThat(UpscaleOption.parse("16x")).isEqualTo(expected);
        assertThat(UpscaleOption.parse("ultra")).isEqualTo(expected);
    }

    @Test
    void modeParseIsLenient() {
        assertThat(UpscaleMode.parse("SMART")).isEqualTo(UpscaleMode.SMART);
        assertThat(UpscaleMode.parse("max")).isEqualTo(UpscaleMode.MAX);
        assertThat(UpscaleMode.parse("whatever")).isEqualTo(UpscaleMode.STANDARD);
        assertThat(UpscaleMode.parse(null)).isEqualTo(UpscaleMode.STANDARD);
        assertThat(UpscaleMode.MAX.label()).isEqualTo("max");
    }
}
