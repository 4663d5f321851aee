/**
 * Presentation layer (REST controller and exception handling).
 *
 * <p>This package is the HTTP boundary of a service. Presentation depends on service and
 * domain, never the other way round.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - The {@code POST /} endpoint</li>
 *   <li>{@code presentation.exception} - Exception to HTTP status/body mapping</li>
 *   <li>{@code presentation.dto} - Error payload</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>The controller is a thin adapter; computing happens in {@code OperationHandler}</li>
 *   <li>The controller never builds error responses itself, it throws domain exceptions</li>
 *   <li>Every response is exactly one of {@code {"result": ...}} (200) or {@code {"error": ...}}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.presentation;
