/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.arithmetic.config.logging.MdcFilter} injects request correlation
 * values into Log4j2's {@code ThreadContext} for every HTTP request.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - X-Request-ID header or a generated UUID</li>
 *   <li>{@code userId} - X-User-ID header, when sent</li>
 *   <li>{@code method}, {@code uri} - request line</li>
 *   <li>{@code operation} - ADD, SUBTRACT, MULTIPLY or DIVIDE</li>
 * </ul>
 *
 * <p>Log Format (see {@code log4j2-spring.xml}):
 * <pre>
 * 2026-10-19 15:42:32.529 [http-nio-3003-exec-1] [requestId] [DIVIDE] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.config.logging;
