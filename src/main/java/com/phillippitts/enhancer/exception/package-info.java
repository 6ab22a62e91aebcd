/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.enhancer.exception.ImageEnhancerException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.enhancer.exception.DecodeException} - Source unreadable by both
 *       the primary and the alternate decoder</li>
 *   <li>{@link com.phillippitts.enhancer.exception.FilterUnavailableException} - A filter cannot
 *       process the buffer's channel layout</li>
 *   <li>{@link com.phillippitts.enhancer.exception.EncodeException} - Output cannot be written</li>
 *   <li>{@link com.phillippitts.enhancer.exception.InvalidRequestException} - Malformed request
 *       at the REST boundary</li>
 * </ul>
 *
 * <p>The enhancement core never lets these escape its entry points; they are converted to a
 * failed {@link com.phillippitts.enhancer.domain.ProcessingResult} by the fallback chain.
 * Only the REST layer maps them to HTTP statuses via {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.enhancer.exception;
