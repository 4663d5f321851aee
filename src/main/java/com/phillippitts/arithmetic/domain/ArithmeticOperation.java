package com.phillippitts.arithmetic.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * The binary operations offered as standalone services.
 *
 * <p>Each constant carries everything that differs between services: the pure function it
 * computes, the operand constraint checked before computing, the service's display name
 * and its default listening port. Everything else (validation, response shaping, error
 * mapping) is shared.
 */
public enum ArithmeticOperation {

    ADD("Adder", 3000, (a, b) -> a + b, OperandConstraint.NONE),
    SUBTRACT("Subtractor", 3001, (a, b) -> a - b, OperandConstraint.NONE),
    MULTIPLY("Multiplier", 3002, (a, b) -> a * b, OperandConstraint.NONE),
    DIVIDE("Divider", 3003, (a, b) -> a / b, OperandConstraint.NON_ZERO_DIVISOR);

    private final String serviceName;
    private final int defaultPort;
    private final DoubleBinaryOperator function;
    private final OperandConstraint constraint;

    ArithmeticOperation(String serviceName, int defaultPort,
                        DoubleBinaryOperator function, OperandConstraint constraint) {
        this.serviceName = serviceName;
        this.defaultPort = defaultPort;
        this.function = function;
        this.constraint = constraint;
    }

    /**
     * Applies the raw function with IEEE-754 double semantics. Does not check the
     * operand constraint.
     */
    public double apply(double a, double b) {
        return function.applyAsDouble(a, b);
    }

    public OperandConstraint getConstraint() {
        return constraint;
    }

    /** Display name of the service, e.g. {@code "Divider"}. */
    public String getServiceName() {
        return serviceName;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    /**
     * Environment variable that overrides the listening port, e.g. {@code DIVIDER_SERVICE_PORT}.
     */
    public String getPortVariable() {
        return serviceName.toUpperCase(Locale.ROOT) + "_SERVICE_PORT";
    }

    /** Spring profile that activates this service, e.g. {@code divider}. */
    public String getProfile() {
        return serviceName.toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves an operation from its enum name ({@code DIVIDE}) or its profile ({@code divider}),
     * ignoring case.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static ArithmeticOperation fromName(String name) {
        Objects.requireNonNull(name, "Operation name must not be null");
        String trimmed = name.trim();
        for (ArithmeticOperation op : values()) {
            if (op.name().equalsIgnoreCase(trimmed) || op.getProfile().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown arithmetic operation: " + name);
    }
}
