package com.phillippitts.arithmetic.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Success payload {@code { "result": number }}.
 *
 * <p>{@code result} is boxed: a computation that overflows to a non-finite value is
 * serialized as {@code null}, and a client reading a body without {@code result} gets
 * {@code null} rather than a failure.
 *
 * @param result computed value, or {@code null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OperationResult(Double result) {

    /**
     * Wraps a computed value, mapping NaN and the infinities to {@code null}.
     */
    public static OperationResult of(double value) {
        return new OperationResult(Double.isFinite(value) ? value : null);
    }
}
