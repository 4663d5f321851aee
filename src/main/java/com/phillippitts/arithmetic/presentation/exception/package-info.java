/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.exception.InvalidOperationRequestException},
 *       unreadable JSON, non-JSON content type → 400 {@code "Invalid request"}</li>
 *   <li>{@link com.phillippitts.arithmetic.exception.OperandConstraintViolationException}
 *       → 400 with the constraint message ({@code "Division by zero"})</li>
 *   <li>Spring MVC errors (404, 405) → their own status with the reason phrase</li>
 *   <li>{@code Exception} (catch-all) → 500 {@code "Internal server error"}</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * { "error": "Division by zero" }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.presentation.exception;
