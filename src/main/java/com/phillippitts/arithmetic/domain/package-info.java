/**
 * Domain model of the arithmetic services.
 *
 * <p>All types here are immutable and free of HTTP and Spring concerns:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.domain.ArithmeticOperation} - The four operations,
 *       each a pure binary function plus its service name, default port and constraint</li>
 *   <li>{@link com.phillippitts.arithmetic.domain.OperandConstraint} - Domain-validity rule on
 *       an operand pair (e.g. non-zero divisor)</li>
 *   <li>{@link com.phillippitts.arithmetic.domain.OperationRequest} - Typed operand pair</li>
 *   <li>{@link com.phillippitts.arithmetic.domain.OperationResult} - Success payload</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.domain;
