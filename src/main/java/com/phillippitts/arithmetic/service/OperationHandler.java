package com.phillippitts.arithmetic.service;

import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.domain.OperandConstraint;
import com.phillippitts.arithmetic.domain.OperationRequest;
import com.phillippitts.arithmetic.exception.OperandConstraintViolationException;

import java.util.Objects;

/**
 * Computes one arithmetic operation on an already validated request.
 *
 * <p>The handler is stateless and thread-safe: it checks the operation's
 * {@link OperandConstraint} and then applies the operation's pure function.
 */
public class OperationHandler {

    private final ArithmeticOperation operation;

    public OperationHandler(ArithmeticOperation operation) {
        this.operation = Objects.requireNonNull(operation, "operation");
    }

    /**
     * @param request validated operands
     * @return the raw IEEE-754 result (may be non-finite on overflow)
     * @throws OperandConstraintViolationException if the operands violate the operation's constraint
     */
    public double handle(OperationRequest request) {
        Objects.requireNonNull(request, "request");
        OperandConstraint constraint = operation.getConstraint();
        if (!constraint.isSatisfiedBy(request.a(), request.b())) {
            throw new OperandConstraintViolationException(operation, constraint.violationMessage());
        }
        return operation.apply(request.a(), request.b());
    }

    public ArithmeticOperation getOperation() {
        return operation;
    }
}
