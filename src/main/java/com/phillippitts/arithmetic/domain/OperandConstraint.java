package com.phillippitts.arithmetic.domain;

/**
 * Domain-validity rule on an operand pair, checked after the request is well-formed and
 * before the operation is computed.
 *
 * <p>A violated constraint is a client error distinct from a malformed request: its
 * {@link #violationMessage()} is returned to the caller verbatim.
 */
public interface OperandConstraint {

    /** Constraint that accepts every operand pair. */
    OperandConstraint NONE = new OperandConstraint() {
        @Override
        public boolean isSatisfiedBy(double a, double b) {
            return true;
        }

        @Override
        public String violationMessage() {
            return "";
        }

        @Override
        public String toString() {
            return "none";
        }
    };

    /** Rejects a zero divisor ({@code -0.0} included). */
    OperandConstraint NON_ZERO_DIVISOR = new OperandConstraint() {
        @Override
        public boolean isSatisfiedBy(double a, double b) {
            return b != 0.0;
        }

        @Override
        public String violationMessage() {
            return "Division by zero";
        }

        @Override
        public String toString() {
            return "non-zero divisor";
        }
    };

    boolean isSatisfiedBy(double a, double b);

    /**
     * Client-facing message reported when {@link #isSatisfiedBy(double, double)} fails.
     */
    String violationMessage();
}
