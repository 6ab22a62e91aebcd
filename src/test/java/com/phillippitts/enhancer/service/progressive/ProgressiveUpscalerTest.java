package com.phillippitts.enhancer.service.progressive;

import com.phillippitts.enhancer.SampleImages;
import com.phillippitts.enhancer.domain.ChannelLayout;
import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.domain.TargetSpec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressiveUpscalerTest {

    private final ProgressiveUpscaler upscaler = new ProgressiveUpscaler();

    @Test
    void doublesUntilTargetReached() {
        List<TargetSpec> steps = ProgressiveUpscaler.planSteps(100, 100, new TargetSpec(400, 400));

        assertThat(steps).containsExactly(new TargetSpec(200, 200), new TargetSpec(400, 400));
    }

    @Test
    void capsStepsForExtremeScales() {
        List<TargetSpec> steps = ProgressiveUpscaler.planSteps(50, 50, TargetSpec.UHD_4K);

        assertThat(steps).hasSizeLessThanOrEqualTo(ProgressiveUpscaler.MAX_STEPS);
        assertThat(steps.get(steps.size() - 1)).isEqualTo(TargetSpec.UHD_4K);
    }

    @Test
    void neverOvershootsOrMoreThanDoublesPerStep() {
        TargetSpec target = TargetSpec.UHD_4K;
        List<TargetSpec> steps = ProgressiveUpscaler.planSteps(800, 600, target);

        int cw = 800;
        int ch = 600;
        for (TargetSpec step : steps) {
            assertThat(step.width()).isLessThanOrEqualTo(target.width());
            assertThat(step.height()).isLessThanOrEqualTo(target.height());
            assertThat(step.width()).isLessThanOrEqualTo(cw * 2 + 1);
            cw = step.width();
            ch = step.height();
        }
        assertThat(ch).isEqualTo(target.height());
        assertThat(steps.get(steps.size() - 1)).isEqualTo(target);
    }

    @Test
    void noStepsWhenSourceAlreadyCoversTarget() {
        assertThat(ProgressiveUpscaler.planSteps(4000, 3000, TargetSpec.HD)).isEmpty();
    }

    @Test
    void singleStepJustAboveOne() {
        assertThat(ProgressiveUpscaler.planSteps(1800, 1000, TargetSpec.HD)).containsExactly(TargetSpec.HD);
    }

    @Test
    void upscaleLandsOnExactTargetForBothVariants() {
        RasterBuffer src = RasterBuffer.of(SampleImages.opaque(20, 15));
        TargetSpec target = new TargetSpec(90, 60);

        RasterBuffer denoised = upscaler.upscale(src, target, ProgressiveUpscaler.Variant.DENOISED_BICUBIC);
        RasterBuffer lanczos = upscaler.upscale(src, target, ProgressiveUpscaler.Variant.LANCZOS);

        assertThat(denoised.width()).isEqualTo(90);
        assertThat(denoised.height()).isEqualTo(60);
        assertThat(lanczos.width()).isEqualTo(90);
        assertThat(lanczos.height()).isEqualTo(60);
    }

    @Test
    void denoisesBeforeEveryStepInBothVariants() {
        List<String> calls = new ArrayList<>();
        ProgressiveUpscaler recording = new ProgressiveUpscaler() {
            @Override
            RasterBuffer denoise(RasterBuffer current, Variant variant) {
                calls.add(variant.denoiseDiameter() + "@" + current.width() + "x" + current.height());
                return super.denoise(current, variant);
            }
        };
        RasterBuffer src = RasterBuffer.of(SampleImages.opaque(10, 10));
        TargetSpec target = new TargetSpec(80, 80);

        recording.upscale(src, target, ProgressiveUpscaler.Variant.DENOISED_BICUBIC);
        recording.upscale(src, target, ProgressiveUpscaler.Variant.LANCZOS);

        // 10 -> 20 -> 40 -> 80: one denoise ahead of each resize
        assertThat(calls).containsExactly(
                "5@10x10", "5@20x20", "5@40x40",
                "9@10x10", "9@20x20", "9@40x40");
    }

    @Test
    void upscaleKeepsAlpha() {
        RasterBuffer src = RasterBuffer.of(SampleImages.translucent(16, 16));

        RasterBuffer out = upscaler.upscale(src, new TargetSpec(64, 64), ProgressiveUpscaler.Variant.LANCZOS);

        assertThat(out.layout()).isEqualTo(ChannelLayout.RGBA);
        assertThat(out.image().getRGB(0, 10) >>> 24).isLessThan(20);
    }
}
