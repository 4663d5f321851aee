/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so that the presentation layer
 * can translate them to HTTP responses in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.exception.ArithmeticServicesException} - Base exception</li>
 *   <li>{@link com.phillippitts.arithmetic.exception.InvalidOperationRequestException} - Malformed
 *       request body (400, {@code "Invalid request"})</li>
 *   <li>{@link com.phillippitts.arithmetic.exception.OperandConstraintViolationException} - Operands
 *       rejected by the operation's constraint (400, e.g. {@code "Division by zero"})</li>
 *   <li>{@link com.phillippitts.arithmetic.exception.ServiceCallException} - Client-side failure
 *       calling a service (non-success status or transport error)</li>
 * </ul>
 *
 * @see com.phillippitts.arithmetic.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.arithmetic.exception;
