package com.phillippitts.enhancer.service.io;

import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.exception.DecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Decodes a source file into a {@link RasterBuffer}.
 *
 * <p>The primary decoder is {@link ImageIO#read(java.io.File)}. If it fails or finds no
 * reader, every reader that claims the stream is tried in turn, plugin readers
 * (TwelveMonkeys) first. Only when both paths fail is a {@link DecodeException} thrown.
 */
@Component
public class ImageDecoder {

    private static final Logger LOG = LogManager.getLogger(ImageDecoder.class);

    private static final String PLUGIN_READER_PREFIX = "com.twelvemonkeys.";

    private final long maxFileSizeBytes;

    public ImageDecoder(EnhancerProperties properties) {
        this.maxFileSizeBytes = properties.getMaxFileSizeBytes();
    }

    /**
     * @param source source file
     * @return decoded buffer with its detected layout
     * @throws DecodeException if the file is missing, too large or unreadable by both decoders
     */
    public RasterBuffer decode(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new DecodeException(source, "file not found");
        }
        long size;
        try {
            size = Files.size(source);
        } catch (IOException e) {
            throw new DecodeException(source, "cannot stat file", e);
        }
        if (size > maxFileSizeBytes) {
            throw new DecodeException(source, "file size " + size + " exceeds limit " + maxFileSizeBytes);
        }

        Exception primaryFailure = null;
        try {
            BufferedImage image = ImageIO.read(source.toFile());
            if (image != null) {
                return RasterBuffer.of(image);
            }
            LOG.debug("Primary decoder found no reader for {}", source.getFileName());
        } catch (IOException | RuntimeException e) {
            primaryFailure = e;
            LOG.warn("Primary decoder failed for {}: {}", source.getFileName(), e.toString());
        }

        BufferedImage image = decodeWithAlternateReaders(source);
        if (image != null) {
            LOG.info("Decoded {} with alternate reader", source.getFileName());
            return RasterBuffer.of(image);
        }
        throw primaryFailure == null
                ? new DecodeException(source, "no decoder could read the file")
                : new DecodeException(source, "no decoder could read the file", primaryFailure);
    }

    private static BufferedImage decodeWithAlternateReaders(Path source) {
        List<ImageReader> readers;
        try (ImageInputStream header = ImageIO.createImageInputStream(source.toFile())) {
            if (header == null) {
                return null;
            }
            readers = orderedReaders(ImageIO.getImageReaders(header));
        } catch (IOException e) {
            LOG.warn("Cannot open {} for alternate decoding: {}", source.getFileName(), e.toString());
            return null;
        }

        for (ImageReader reader : readers) {
            try (ImageInputStream iis = ImageIO.createImageInputStream(source.toFile())) {
                reader.setInput(iis, true, true);
                return reader.read(0);
            } catch (IOException | RuntimeException e) {
                LOG.debug("Reader {} failed for {}: {}", reader.getClass().getName(),
                        source.getFileName(), e.toString());
            } finally {
                reader.dispose();
            }
        }
        return null;
    }

    private static List<ImageReader> orderedReaders(Iterator<ImageReader> it) {
        List<ImageReader> plugin = new ArrayList<>();
        List<ImageReader> builtIn = new ArrayList<>();
        while (it.hasNext()) {
            ImageReader reader = it.next();
            if (reader.getClass().getName().startsWith(PLUGIN_READER_PREFIX)) {
                plugin.add(reader);
            } else {
                builtIn.add(reader);
            }
        }
        plugin.addAll(builtIn);
        return plugin;
    }
}
