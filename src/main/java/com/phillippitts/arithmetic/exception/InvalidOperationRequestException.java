package com.phillippitts.arithmetic.exception;

/**
 * Thrown when a request body is missing, is not a JSON object, or does not carry two
 * finite numeric operands {@code a} and {@code b}.
 *
 * <p>The reason is kept for server-side logs; clients only ever see {@code "Invalid request"}.
 */
public class InvalidOperationRequestException extends ArithmeticServicesException {

    private final String reason;

    public InvalidOperationRequestException(String reason) {
        super("Invalid operation request: " + reason);
        this.reason = reason;
    }

    public InvalidOperationRequestException(String reason, Throwable cause) {
        super("Invalid operation request: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
