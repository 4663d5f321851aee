package com.phillippitts.arithmetic.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.arithmetic.domain.OperationRequest;
import com.phillippitts.arithmetic.exception.InvalidOperationRequestException;
import org.springframework.stereotype.Component;

/**
 * Validates a raw JSON body and converts it into a typed {@link OperationRequest}.
 *
 * <p>Rules, applied in order:
 * <ol>
 *   <li>the body is present and is a JSON object</li>
 *   <li>{@code a} and {@code b} are JSON numbers (strings, booleans, null and missing fields are rejected;
 *       no coercion from strings)</li>
 *   <li>both values are finite once read as doubles ({@code 1e400} overflows and is rejected)</li>
 * </ol>
 * Extra fields are ignored.
 */
@Component
public class OperationRequestValidator {

    static final String FIELD_A = "a";
    static final String FIELD_B = "b";

    /**
     * @param body parsed request body, {@code null} when the request had none
     * @return typed operands
     * @throws InvalidOperationRequestException when any rule is violated
     */
    public OperationRequest validate(JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new InvalidOperationRequestException("Request body is missing");
        }
        if (!body.isObject()) {
            throw new InvalidOperationRequestException(
                    "Request body must be a JSON object, got " + body.getNodeType());
        }
        double a = requireFiniteNumber(body, FIELD_A);
        double b = requireFiniteNumber(body, FIELD_B);
        return new OperationRequest(a, b);
    }

    private static double requireFiniteNumber(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null) {
            throw new InvalidOperationRequestException("Field '" + field + "' is missing");
        }
        if (!value.isNumber()) {
            throw new InvalidOperationRequestException(
                    "Field '" + field + "' must be a number, got " + value.getNodeType());
        }
        double d = value.asDouble();
        if (!Double.isFinite(d)) {
            throw new InvalidOperationRequestException("Field '" + field + "' is not finite: " + value);
        }
        return d;
    }
}
