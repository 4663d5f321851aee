/**
 * Response bodies specific to the HTTP boundary.
 *
 * <p>The success body is the domain's {@link com.phillippitts.arithmetic.domain.OperationResult},
 * shared with the clients; error bodies are {@link com.phillippitts.arithmetic.presentation.dto.ApiError}.
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.presentation.dto;
