package com.phillippitts.enhancer.service.fallback;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ImageFormat;
import com.phillippitts.enhancer.domain.Operation;
import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.domain.UpscaleMode;

import java.nio.file.Path;

/**
 * Core entry points. Implementations never throw for processing failures; the outcome is
 * always reported through the returned {@link ProcessingResult}.
 */
public interface EnhancementService {

    /**
     * Runs one enhancement.
     *
     * @param request immutable request
     * @return success with the output path, or a failure marker
     */
    ProcessingResult enhance(EnhancementRequest request);

    default ProcessingResult toHD(Path source) {
        return enhance(EnhancementRequest.of(source, Operation.TO_HD));
    }

    default ProcessingResult to4K(Path source) {
        return enhance(EnhancementRequest.of(source, Operation.TO_4K));
    }

    default ProcessingResult to4KCompressed(Path source) {
        return enhance(EnhancementRequest.of(source, Operation.TO_4K_COMPRESSED));
    }

    default ProcessingResult optimize(Path source) {
        return enhance(EnhancementRequest.of(source, Operation.OPTIMIZE));
    }

    default ProcessingResult convertFormat(Path source, ImageFormat targetFormat) {
        return enhance(EnhancementRequest.convert(source, targetFormat));
    }

    default ProcessingResult customUpscale(Path source, int scaleFactor, UpscaleMode mode) {
        return enhance(EnhancementRequest.customUpscale(source, scaleFactor, mode));
    }
}
