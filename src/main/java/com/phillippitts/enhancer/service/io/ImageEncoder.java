package com.phillippitts.enhancer.service.io;

import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.exception.EncodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Locale;

/**
 * Writes a buffer according to an {@link OutputSpec}.
 *
 * <p>Lossy writers get explicit compression quality; progressive mode is requested only
 * when the writer can produce it. The file is written to a uniquely named sibling
 * {@code .part} file and moved into place, so a failed write never leaves a truncated output
 * behind.
 */
@Component
public class ImageEncoder {

    private static final Logger LOG = LogManager.getLogger(ImageEncoder.class);

    /**
     * @param buffer buffer already prepared for {@code spec.format()}
     * @param spec   output specification
     * @return written path
     * @throws EncodeException if no writer exists or the write fails
     */
    public Path encode(RasterBuffer buffer, OutputSpec spec) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(spec.format().formatName());
        if (!writers.hasNext()) {
            throw new EncodeException(spec.format(), "no ImageIO writer available");
        }
        ImageWriter writer = writers.next();
        Path target = spec.path();
        Path partial = null;
        try {
            Path dir = Files.createDirectories(target.toAbsolutePath().getParent());
            // Unique per call; requests for the same output may run concurrently
            partial = Files.createTempFile(dir, target.getFileName() + ".", ".part");
            try (ImageOutputStream ios = ImageIO.createImageOutputStream(partial.toFile())) {
                if (ios == null) {
                    throw new EncodeException(spec.format(), "cannot open output stream for " + partial);
                }
                writer.setOutput(ios);
                writer.write(null, new IIOImage(buffer.image(), null, null), writeParam(writer, spec));
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            if (partial != null) {
                deleteQuietly(partial);
            }
            if (e instanceof EncodeException ee) {
                throw ee;
            }
            throw new EncodeException(spec.format(), "write failed for " + target.getFileName(), e);
        } finally {
            writer.dispose();
        }
        LOG.debug("Wrote {} ({} q={}, progressive={})", target.getFileName(),
                spec.format(), spec.quality(), spec.progressive());
        return target;
    }

    private static ImageWriteParam writeParam(ImageWriter writer, OutputSpec spec) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (spec.format().isLossy() && param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            String[] types = param.getCompressionTypes();
            if (types != null && types.length > 0) {
                // WebP writers offer Lossy and Lossless; quality only applies to the former
                param.setCompressionType(lossyType(types));
            }
            param.setCompressionQuality(spec.quality() / 100f);
        }
        if (spec.progressive() && param.canWriteProgressive()) {
            param.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
        }
        return param;
    }

    private static String lossyType(String[] types) {
        for (String t : types) {
            if (t.toLowerCase(Locale.ROOT).contains("lossy")) {
                return t;
            }
        }
        return types[0];
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.debug("Could not remove partial file {}: {}", p, e.toString());
        }
    }
}
