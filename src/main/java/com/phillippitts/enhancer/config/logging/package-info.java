/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code operation} - Enhancement operation, added by the dispatcher</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [enhance-pool-1] [requestId] [operation] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.enhancer.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.enhancer.config.logging;
