package com.phillippitts.enhancer.config;

import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TempDirectoryInitializerTest {

    @TempDir
    Path tempDir;

    @Test
    void createsNestedOutputDirectory() {
        Path out = tempDir.resolve("a/b/bot_images");

        new TempDirectoryInitializer(EnhancerProperties.withTempDir(out)).createTempDirectory();

        assertThat(out).isDirectory();
    }

    @Test
    void failsWhenPathIsAFile() throws IOException {
        Path file = Files.createFile(tempDir.resolve("taken"));

        assertThatThrownBy(() -> new TempDirectoryInitializer(EnhancerProperties.withTempDir(file)).createTempDirectory())
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("taken");
    }
}
