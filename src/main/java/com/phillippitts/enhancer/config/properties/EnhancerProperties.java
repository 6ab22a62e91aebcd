package com.phillippitts.enhancer.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the enhancement pipeline.
 *
 * <p>Properties:
 * <ul>
 *   <li>enhancer.temp-dir - shared directory for outputs (default: {@code java.io.tmpdir/bot_images})</li>
 *   <li>enhancer.max-file-size-bytes - largest accepted source file (default: 20 MB)</li>
 *   <li>enhancer.optimize-max-dimension - longest side after optimize (default: 2048)</li>
 *   <li>enhancer.max-output-pixels - largest output raster accepted before any pixel work
 *       starts (default: 7680x4320)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "enhancer")
public class EnhancerProperties {

    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 20L * 1024 * 1024;
    public static final int DEFAULT_OPTIMIZE_MAX_DIMENSION = 2048;
    public static final long DEFAULT_MAX_OUTPUT_PIXELS = 7680L * 4320;

    @NotNull
    private final Path tempDir;

    @Positive(message = "Maximum file size must be positive")
    private final long maxFileSizeBytes;

    @Min(value = 64, message = "Optimize max dimension must be at least 64 px")
    private final int optimizeMaxDimension;

    @Positive(message = "Maximum output pixels must be positive")
    private final long maxOutputPixels;

    @ConstructorBinding
    public EnhancerProperties(Path tempDir, Long maxFileSizeBytes, Integer optimizeMaxDimension,
                              Long maxOutputPixels) {
        this.tempDir = tempDir == null
                ? Path.of(System.getProperty("java.io.tmpdir"), "bot_images")
                : tempDir;
        this.maxFileSizeBytes = maxFileSizeBytes == null ? DEFAULT_MAX_FILE_SIZE_BYTES : maxFileSizeBytes;
        this.optimizeMaxDimension = optimizeMaxDimension == null
                ? DEFAULT_OPTIMIZE_MAX_DIMENSION
                : optimizeMaxDimension;
        this.maxOutputPixels = maxOutputPixels == null ? DEFAULT_MAX_OUTPUT_PIXELS : maxOutputPixels;
    }

    /** Defaults rooted at the given directory; convenient for tests. */
    public static EnhancerProperties withTempDir(Path tempDir) {
        return new EnhancerProperties(tempDir, null, null, null);
    }

    public Path getTempDir() {
        return tempDir;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public int getOptimizeMaxDimension() {
        return optimizeMaxDimension;
    }

    public long getMaxOutputPixels() {
        return maxOutputPixels;
    }
}
