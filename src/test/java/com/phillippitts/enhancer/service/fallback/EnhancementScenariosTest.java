package com.phillippitts.enhancer.service.fallback;

import com.phillippitts.enhancer.SampleImages;
import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import com.phillippitts.enhancer.domain.ImageFormat;
import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.domain.UpscaleMode;
import com.phillippitts.enhancer.service.fallback.event.AllEnhancementStrategiesFailedEvent;
import com.phillippitts.enhancer.service.io.ImageDecoder;
import com.phillippitts.enhancer.service.io.ImageEncoder;
import com.phillippitts.enhancer.service.io.OutputPolicy;
import com.phillippitts.enhancer.service.normalize.ColorNormalizer;
import com.phillippitts.enhancer.service.pipeline.EnhancementPipeline;
import com.phillippitts.enhancer.service.pipeline.PathTransforms;
import com.phillippitts.enhancer.service.progressive.ProgressiveUpscaler;
import com.phillippitts.enhancer.service.strategy.StrategySelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end runs through the real pipeline: decode, select, transform, encode.
 */
class EnhancementScenariosTest {

    @TempDir
    Path tempDir;

    private final List<Object> events = new ArrayList<>();
    private EnhancementService service;

    @BeforeEach
    void setUp() {
        EnhancerProperties props = EnhancerProperties.withTempDir(tempDir);
        ColorNormalizer normalizer = new ColorNormalizer();
        EnhancementPipeline pipeline = new EnhancementPipeline(new ImageDecoder(props), normalizer,
                new OutputPolicy(props), new ImageEncoder());
        PathTransforms transforms = new PathTransforms(new StrategySelector(props), new ProgressiveUpscaler(),
                normalizer);
        service = new StrategyChainEnhancementService(List.of(
                new SimpleEnhancementStrategy(pipeline, transforms),
                new PreferredEnhancementStrategy(pipeline, transforms)), events::add);
    }

    @Test
    void customStandardUpscaleMultipliesWithoutCropping() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(100, 100), "png", tempDir.resolve("square.png"));

        ProcessingResult result = service.customUpscale(src, 4, UpscaleMode.STANDARD);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.strategy()).isEqualTo("STANDARD");
        assertThat(result.outputPath()).isEqualTo(tempDir.resolve("square_4x_standard.jpg"));
        BufferedImage out = ImageIO.read(result.outputPath().toFile());
        assertThat(out.getWidth()).isEqualTo(400);
        assertThat(out.getHeight()).isEqualTo(400);
        assertThat(out.getColorModel().hasAlpha()).isFalse();
    }

    @Test
    void largeSourceToHdIsCentreCroppedAndResized() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(2400, 1500), "png", tempDir.resolve("large.png"));

        ProcessingResult result = service.toHD(src);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.strategy()).isEqualTo("SMART_RESIZE");
        BufferedImage out = ImageIO.read(result.outputPath().toFile());
        assertThat(out.getWidth()).isEqualTo(1920);
        assertThat(out.getHeight()).isEqualTo(1080);
    }

    @Test
    void tinySourceTo4kUsesSingleStep() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(50, 50), "png", tempDir.resolve("tiny.png"));

        ProcessingResult result = service.to4K(src);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.strategy()).isEqualTo("SINGLE_STEP_HQ");
        assertThat(result.outputPath()).isEqualTo(tempDir.resolve("tiny_4K.jpg"));
        BufferedImage out = ImageIO.read(result.outputPath().toFile());
        assertThat(out.getWidth()).isEqualTo(3840);
        assertThat(out.getHeight()).isEqualTo(2160);
    }

    @Test
    void maxUpscaleKeepsAlphaLosslesslyAndOpaqueSourcesGoLossy() throws IOException {
        Path rgba = SampleImages.write(SampleImages.translucent(40, 40), "png", tempDir.resolve("logo.png"));
        Path rgb = SampleImages.write(SampleImages.opaque(40, 40), "png", tempDir.resolve("photo.png"));

        ProcessingResult withAlpha = service.customUpscale(rgba, 2, UpscaleMode.MAX);
        ProcessingResult opaque = service.customUpscale(rgb, 2, UpscaleMode.MAX);

        assertThat(withAlpha.outputPath()).isEqualTo(tempDir.resolve("logo_2x_max.png"));
        BufferedImage out = ImageIO.read(withAlpha.outputPath().toFile());
        assertThat(out.getColorModel().hasAlpha()).isTrue();
        assertThat(out.getWidth()).isEqualTo(80);
        assertThat(out.getRGB(0, 40) >>> 24).isLessThan(16);
        assertThat(out.getRGB(79, 40) >>> 24).isGreaterThan(240);
        assertThat(opaque.outputPath()).isEqualTo(tempDir.resolve("photo_2x_max.jpg"));
    }

    @Test
    void corruptSourceEndsInFailureMarker() throws IOException {
        Path corrupt = tempDir.resolve("broken.jpg");
        Files.write(corrupt, new byte[] {(byte) 0xFF, (byte) 0xD8, 0x00, 0x01, 0x02, 0x03});

        ProcessingResult result = service.toHD(corrupt);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failureReason()).startsWith("decode:");
        assertThat(events).last().isInstanceOf(AllEnhancementStrategiesFailedEvent.class);
        assertThat(tempDir.resolve("broken_HD.jpg")).doesNotExist();
    }

    @Test
    void optimizeNeverGrowsAJpegThatAlreadyFits() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(320, 240), "jpg", tempDir.resolve("small.jpg"));

        ProcessingResult first = service.optimize(src);

        assertThat(first.isSuccess()).isTrue();
        assertThat(Files.size(first.outputPath())).isLessThanOrEqualTo(Files.size(src));
        BufferedImage out = ImageIO.read(first.outputPath().toFile());
        assertThat(out.getWidth()).isEqualTo(320);
    }

    @Test
    void optimizeBoundsOversizedSources() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(2600, 200), "png", tempDir.resolve("banner.png"));

        ProcessingResult result = service.optimize(src);

        BufferedImage out = ImageIO.read(result.outputPath().toFile());
        assertThat(out.getWidth()).isEqualTo(2048);
        assertThat(out.getHeight()).isEqualTo(157);
    }

    @Test
    void pngToPngConversionIsPixelExact() throws IOException {
        BufferedImage original = SampleImages.translucent(23, 17);
        Path src = SampleImages.write(original, "png", tempDir.resolve("icon.png"));

        ProcessingResult result = service.convertFormat(src, ImageFormat.PNG);

        assertThat(result.strategy()).isEqualTo("CONVERT");
        BufferedImage out = ImageIO.read(result.outputPath().toFile());
        for (int y = 0; y < 17; y++) {
            for (int x = 0; x < 23; x++) {
                assertThat(out.getRGB(x, y)).isEqualTo(original.getRGB(x, y));
            }
        }
    }

    @Test
    void conversionToJpegFlattensAlpha() throws IOException {
        Path src = SampleImages.write(SampleImages.translucent(10, 10), "png", tempDir.resolve("clip.png"));

        ProcessingResult result = service.convertFormat(src, ImageFormat.JPEG);

        assertThat(result.outputPath()).isEqualTo(tempDir.resolve("clip_converted.jpg"));
        BufferedImage out = ImageIO.read(result.outputPath().toFile());
        assertThat(out.getColorModel().hasAlpha()).isFalse();
        // fully transparent column composited on white
        assertThat((out.getRGB(0, 5) >> 16) & 0xFF).isGreaterThan(240);
    }

    @Test
    void conversionToWebpEncodesAtRequestedSize() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(64, 64), "png", tempDir.resolve("pic.png"));

        ProcessingResult result = service.convertFormat(src, ImageFormat.WEBP);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.outputPath()).isEqualTo(tempDir.resolve("pic_converted.webp"));
        BufferedImage out = ImageIO.read(result.outputPath().toFile());
        assertThat(out.getWidth()).isEqualTo(64);
        assertThat(out.getHeight()).isEqualTo(64);
    }

    @Test
    void oversizedUpscaleEndsInFailureMarkerBeforeAllocating() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(2000, 2000), "png", tempDir.resolve("poster.png"));

        ProcessingResult result = service.customUpscale(src, 8, UpscaleMode.STANDARD);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failureReason()).startsWith("limit:").contains("16000x16000");
        assertThat(events).last().isInstanceOf(AllEnhancementStrategiesFailedEvent.class);
        assertThat(tempDir.resolve("poster_8x_standard.jpg")).doesNotExist();
    }

    @Test
    void compressed4kHitsExactTargetAndIsSmallerThanFull4k() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(480, 270), "png", tempDir.resolve("frame.png"));

        ProcessingResult full = service.to4K(src);
        ProcessingResult compressed = service.to4KCompressed(src);

        assertThat(full.isSuccess()).isTrue();
        assertThat(compressed.isSuccess()).isTrue();
        assertThat(compressed.outputPath()).isEqualTo(tempDir.resolve("frame_4K_compressed.jpg"));
        BufferedImage out = ImageIO.read(compressed.outputPath().toFile());
        assertThat(out.getWidth()).isEqualTo(3840);
        assertThat(out.getHeight()).isEqualTo(2160);
        assertThat(Files.size(compressed.outputPath())).isLessThan(Files.size(full.outputPath()));
    }

    @Test
    void optimizingAnOptimizedImageDoesNotGrowIt() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(2600, 200), "png", tempDir.resolve("wide.png"));

        ProcessingResult first = service.optimize(src);
        ProcessingResult second = service.optimize(first.outputPath());

        assertThat(second.isSuccess()).isTrue();
        assertThat(Files.size(second.outputPath())).isLessThanOrEqualTo(Files.size(first.outputPath()));
        BufferedImage once = ImageIO.read(first.outputPath().toFile());
        BufferedImage twice = ImageIO.read(second.outputPath().toFile());
        assertThat(twice.getWidth()).isEqualTo(once.getWidth());
        assertThat(twice.getHeight()).isEqualTo(once.getHeight());
    }

    @Test
    void jpegToPngToJpegKeepsDimensionsAndOpaqueLayout() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(120, 80), "jpg", tempDir.resolve("trip.jpg"));

        ProcessingResult toPng = service.convertFormat(src, ImageFormat.PNG);
        ProcessingResult back = service.convertFormat(toPng.outputPath(), ImageFormat.JPEG);

        assertThat(toPng.outputPath()).isEqualTo(tempDir.resolve("trip_converted.png"));
        BufferedImage png = ImageIO.read(toPng.outputPath().toFile());
        assertThat(png.getWidth()).isEqualTo(120);
        assertThat(png.getHeight()).isEqualTo(80);
        assertThat(png.getColorModel().hasAlpha()).isFalse();

        assertThat(back.outputPath()).isEqualTo(tempDir.resolve("trip_converted_converted.jpg"));
        BufferedImage jpeg = ImageIO.read(back.outputPath().toFile());
        assertThat(jpeg.getWidth()).isEqualTo(120);
        assertThat(jpeg.getHeight()).isEqualTo(80);
        assertThat(jpeg.getColorModel().hasAlpha()).isFalse();
    }

    @Test
    void customUpscaleMultipliesExactlyForEveryFactorAndMode() throws IOException {
        Path src = SampleImages.write(SampleImages.opaque(12, 9), "png", tempDir.resolve("thumb.png"));

        for (UpscaleMode mode : UpscaleMode.values()) {
            for (int factor : new int[] {2, 3, 4, 8}) {
                ProcessingResult result = service.customUpscale(src, factor, mode);

                assertThat(result.isSuccess()).as("%dx %s", factor, mode).isTrue();
                BufferedImage out = ImageIO.read(result.outputPath().toFile());
                assertThat(out.getWidth()).as("%dx %s width", factor, mode).isEqualTo(12 * factor);
                assertThat(out.getHeight()).as("%dx %s height", factor, mode).isEqualTo(9 * factor);
            }
        }
    }
}
