package com.phillippitts.enhancer.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSizeFormatterTest {

    @Test
    void formatsWithBinaryUnits() {
        assertThat(FileSizeFormatter.format(0)).isEqualTo("0.0 B");
        assertThat(FileSizeFormatter.format(512)).isEqualTo("512.0 B");
        assertThat(FileSizeFormatter.format(1536)).isEqualTo("1.5 KB");
        assertThat(FileSizeFormatter.format(20L * 1024 * 1024)).isEqualTo("20.0 MB");
        assertThat(FileSizeFormatter.format(3L * 1024 * 1024 * 1024)).isEqualTo("3.0 GB");
        assertThat(FileSizeFormatter.format(2L * 1024 * 1024 * 1024 * 1024)).isEqualTo("2.0 TB");
    }

    @Test
    void rejectsNegativeSizes() {
        assertThatThrownBy(() -> FileSizeFormatter.format(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
