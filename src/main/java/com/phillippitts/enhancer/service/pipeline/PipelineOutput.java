package com.phillippitts.enhancer.service.pipeline;

import java.nio.file.Path;

/**
 * Written output of one pipeline run.
 *
 * @param path   output file
 * @param method algorithm that produced the pixels
 */
public record PipelineOutput(Path path, String method) {
}
