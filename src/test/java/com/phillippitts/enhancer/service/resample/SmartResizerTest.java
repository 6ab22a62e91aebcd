package com.phillippitts.enhancer.service.resample;

import com.phillippitts.enhancer.SampleImages;
import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.domain.TargetSpec;
import org.junit.jupiter.api.Test;

import java.awt.Rectangle;

import static org.assertj.core.api.Assertions.assertThat;

class SmartResizerTest {

    @Test
    void cropsHeightOfSourceNarrowerThanTarget() {
        Rectangle r = SmartResizer.cropRegion(5000, 3000, TargetSpec.HD);

        assertThat(r).isEqualTo(new Rectangle(0, 94, 5000, 2812));
    }

    @Test
    void cropsWidthOfSourceWiderThanTarget() {
        Rectangle r = SmartResizer.cropRegion(4000, 1000, TargetSpec.HD);

        assertThat(r.width).isEqualTo(1777);
        assertThat(r.height).isEqualTo(1000);
        int leftMargin = r.x;
        int rightMargin = 4000 - (r.x + r.width);
        assertThat(Math.abs(leftMargin - rightMargin)).isLessThanOrEqualTo(1);
    }

    @Test
    void keepsWholeImageWhenAspectMatches() {
        assertThat(SmartResizer.cropRegion(3840, 2160, TargetSpec.HD)).isEqualTo(new Rectangle(0, 0, 3840, 2160));
        // 1.7777 vs 1.7700 is inside the tolerance
        assertThat(SmartResizer.cropRegion(1770, 1000, TargetSpec.HD)).isEqualTo(new Rectangle(0, 0, 1770, 1000));
    }

    @Test
    void resizeProducesExactTarget() {
        RasterBuffer src = RasterBuffer.of(SampleImages.opaque(400, 300));

        RasterBuffer out = SmartResizer.resize(src, new TargetSpec(160, 90));

        assertThat(out.width()).isEqualTo(160);
        assertThat(out.height()).isEqualTo(90);
        assertThat(out.layout()).isEqualTo(src.layout());
    }
}
