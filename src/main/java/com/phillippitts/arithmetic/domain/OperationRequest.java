package com.phillippitts.arithmetic.domain;

/**
 * Operand pair of a single service call.
 *
 * <p>The record itself performs no checks: clients send whatever they are given, and the
 * service builds instances only after validating the incoming JSON.
 *
 * @param a left operand
 * @param b right operand
 */
public record OperationRequest(double a, double b) {

    public static OperationRequest of(double a, double b) {
        return new OperationRequest(a, b);
    }
}
