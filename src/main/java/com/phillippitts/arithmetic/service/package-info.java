/**
 * Service layer: the shared operation handler and its collaborators.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.validation} - JSON body to typed request validation</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation</li>
 * </ul>
 *
 * <p>Services depend on domain types only, throw domain exceptions (never HTTP ones)
 * and keep no per-request state.
 *
 * @see com.phillippitts.arithmetic.service.OperationHandler
 * @since 1.0
 */
package com.phillippitts.arithmetic.service;
