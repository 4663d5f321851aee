/**
 * Input validation for operation requests.
 *
 * <p>{@link com.phillippitts.arithmetic.service.validation.OperationRequestValidator} turns the
 * untyped JSON body into an {@link com.phillippitts.arithmetic.domain.OperationRequest}, or throws
 * {@link com.phillippitts.arithmetic.exception.InvalidOperationRequestException}, which the
 * {@code GlobalExceptionHandler} maps to HTTP 400 {@code {"error":"Invalid request"}}.
 *
 * <p>Validation runs before any business logic; the operation handler only ever sees
 * two finite doubles.
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.service.validation;
