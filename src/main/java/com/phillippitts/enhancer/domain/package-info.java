/**
 * Immutable domain models of the enhancement pipeline.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.enhancer.domain.EnhancementRequest} - One caller action:
 *       source, operation and its parameters</li>
 *   <li>{@link com.phillippitts.enhancer.domain.RasterBuffer} - Decoded pixels and their
 *       channel layout</li>
 *   <li>{@link com.phillippitts.enhancer.domain.TargetSpec} - Output dimensions</li>
 *   <li>{@link com.phillippitts.enhancer.domain.ProcessingResult} - Output path or failure
 *       marker</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.enhancer.domain;
