/**
 * Service layer: the image enhancement pipeline and its supervision.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.strategy} - Maps operation, source size and mode to an algorithm path</li>
 *   <li>{@code service.resample} - Interpolation kernels, resampler and filter primitives</li>
 *   <li>{@code service.progressive} - Multi-step upscaling for large factors</li>
 *   <li>{@code service.normalize} - Channel layout reconciliation</li>
 *   <li>{@code service.io} - Decoding, encoding and output policy</li>
 *   <li>{@code service.pipeline} - Decode, transform, encode for one request</li>
 *   <li>{@code service.fallback} - Strategy chain that never throws to its caller</li>
 *   <li>{@code service.dispatch} - Bounded worker pool submission</li>
 *   <li>{@code service.hook} - Pre/post callbacks and processing statistics</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Pixel primitives are stateless static utilities; orchestration lives in Spring beans</li>
 *   <li>All per-request state is local to the call; nothing is shared between workers</li>
 *   <li>Stages throw domain exceptions; only the fallback chain converts them to results</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.enhancer.service;
