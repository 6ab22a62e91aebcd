package com.phillippitts.enhancer.config;

import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates the shared output directory once the application is ready. Startup fails if the
 * directory cannot be created, since no enhancement could ever be written.
 */
@Component
public class TempDirectoryInitializer {

    private static final Logger LOG = LogManager.getLogger(TempDirectoryInitializer.class);

    private final Path tempDir;

    public TempDirectoryInitializer(EnhancerProperties properties) {
        this.tempDir = properties.getTempDir();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void createTempDirectory() {
        try {
            Files.createDirectories(tempDir);
            LOG.info("Enhancement output directory: {}", tempDir.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create enhancement output directory " + tempDir, e);
        }
    }
}
