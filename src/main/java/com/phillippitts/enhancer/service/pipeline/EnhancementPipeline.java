package com.phillippitts.enhancer.service.pipeline;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ImageFormat;
import com.phillippitts.enhancer.domain.Operation;
import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.exception.EncodeException;
import com.phillippitts.enhancer.service.io.ImageDecoder;
import com.phillippitts.enhancer.service.io.ImageEncoder;
import com.phillippitts.enhancer.service.io.OutputPolicy;
import com.phillippitts.enhancer.service.io.OutputSpec;
import com.phillippitts.enhancer.service.normalize.ColorNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * One-way pipeline: decode, normalize to the working layout, transform, normalize for the
 * target encoding, encode.
 *
 * <p>Every stage throws on failure; the fallback chain decides what to do about it. All state
 * is local to the call.
 */
@Component
public class EnhancementPipeline {

    private static final Logger LOG = LogManager.getLogger(EnhancementPipeline.class);

    private final ImageDecoder decoder;
    private final ColorNormalizer normalizer;
    private final OutputPolicy outputPolicy;
    private final ImageEncoder encoder;

    public EnhancementPipeline(ImageDecoder decoder, ColorNormalizer normalizer,
                               OutputPolicy outputPolicy, ImageEncoder encoder) {
        this.decoder = decoder;
        this.normalizer = normalizer;
        this.outputPolicy = outputPolicy;
        this.encoder = encoder;
    }

    /**
     * Runs the pipeline with the given pixel transform.
     *
     * @param request   enhancement request
     * @param transform pixel stage
     * @return written output and the method that produced it
     */
    public PipelineOutput execute(EnhancementRequest request, BufferTransform transform) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(transform, "transform");

        RasterBuffer decoded = decoder.decode(request.source());
        RasterBuffer working = normalizer.toWorkingLayout(decoded);
        if (decoded.layout() != working.layout()) {
            LOG.debug("Normalized {} -> {}", decoded.layout(), working.layout());
        }

        Transformed transformed = transform.apply(working, request);
        OutputSpec spec = outputPolicy.outputFor(request, transformed.buffer().layout());
        RasterBuffer encodable = normalizer.forEncoding(transformed.buffer(), spec.format());
        Path written = encoder.encode(encodable, spec);

        if (request.operation() == Operation.OPTIMIZE
                && decoded.width() == encodable.width() && decoded.height() == encodable.height()) {
            keepSmallerOptimizeOutput(request.source(), written);
        }
        return new PipelineOutput(written, transformed.method());
    }

    /**
     * Optimize must not grow a JPEG that already fits: when re-encoding produced more bytes
     * than the source, the source bytes are kept.
     */
    private static void keepSmallerOptimizeOutput(Path source, Path written) {
        try {
            if (!isJpeg(source)) {
                return;
            }
            long sourceSize = Files.size(source);
            long writtenSize = Files.size(written);
            if (writtenSize > sourceSize) {
                Files.copy(source, written, StandardCopyOption.REPLACE_EXISTING);
                LOG.info("Optimized output larger than source ({} > {} bytes); kept source bytes",
                        writtenSize, sourceSize);
            }
        } catch (IOException e) {
            throw new EncodeException(ImageFormat.JPEG, "cannot compare optimize output with source", e);
        }
    }

    private static boolean isJpeg(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return in.read() == 0xFF && in.read() == 0xD8;
        }
    }
}
