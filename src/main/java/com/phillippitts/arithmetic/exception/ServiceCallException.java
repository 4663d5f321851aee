package com.phillippitts.arithmetic.exception;

/**
 * Thrown (as the cause of a failed future) when a client call to an arithmetic service
 * does not produce a success response.
 *
 * <p>Either the service answered with a non-2xx status ({@link #getStatusCode()} holds it),
 * or the exchange failed at the transport level ({@link #getStatusCode()} is {@code 0} and
 * the cause is set).
 */
public class ServiceCallException extends ArithmeticServicesException {

    private final String serviceName;
    private final int statusCode;
    private final String errorMessage;

    public ServiceCallException(String serviceName, int statusCode, String errorMessage) {
        super(describe(serviceName, statusCode, errorMessage));
        this.serviceName = serviceName;
        this.statusCode = statusCode;
        this.errorMessage = errorMessage;
    }

    public ServiceCallException(String serviceName, Throwable cause) {
        super(serviceName + " Service call failed: " + cause.getMessage(), cause);
        this.serviceName = serviceName;
        this.statusCode = 0;
        this.errorMessage = null;
    }

    private static String describe(String serviceName, int statusCode, String errorMessage) {
        String base = serviceName + " Service returned status " + statusCode;
        return errorMessage == null ? base : base + ": " + errorMessage;
    }

    /** Display name of the called service, e.g. {@code "Divider"}. */
    public String getServiceName() {
        return serviceName;
    }

    /** HTTP status received, or {@code 0} for transport failures. */
    public int getStatusCode() {
        return statusCode;
    }

    /** The {@code error} field of the response body, or {@code null} if absent. */
    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isTransportFailure() {
        return statusCode == 0;
    }
}
