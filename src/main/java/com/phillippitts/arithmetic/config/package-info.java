/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.config.OperationConfig} - Creates the operation handler
 *       for the configured operation and its actuator info entry</li>
 *   <li>{@link com.phillippitts.arithmetic.config.properties.ArithmeticServiceProperties} - Typed
 *       {@code arithmetic.service.*} settings</li>
 * </ul>
 *
 * <p>Port selection lives in the per-service profiles: {@code application-divider.properties}
 * binds {@code server.port=${DIVIDER_SERVICE_PORT:3003}}, and likewise for the other services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed configuration properties</li>
 *   <li>{@code config.logging} - Logging infrastructure (MDC filter)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.config;
