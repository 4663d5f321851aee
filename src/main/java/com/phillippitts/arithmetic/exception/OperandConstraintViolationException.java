package com.phillippitts.arithmetic.exception;

import com.phillippitts.arithmetic.domain.ArithmeticOperation;

/**
 * Thrown when a well-formed operand pair violates the operation's domain constraint,
 * e.g. a zero divisor. The message is client-facing.
 */
public class OperandConstraintViolationException extends ArithmeticServicesException {

    private final ArithmeticOperation operation;

    public OperandConstraintViolationException(ArithmeticOperation operation, String message) {
        super(message);
        this.operation = operation;
    }

    public ArithmeticOperation getOperation() {
        return operation;
    }
}
