package com.phillippitts.arithmetic.exception;

/**
 * Base exception for all arithmetic-services errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ArithmeticServicesException extends RuntimeException {

    public ArithmeticServicesException(String message) {
        super(message);
    }

    public ArithmeticServicesException(String message, Throwable cause) {
        super(message, cause);
    }
}
