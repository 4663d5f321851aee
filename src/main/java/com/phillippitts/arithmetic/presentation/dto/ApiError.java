package com.phillippitts.arithmetic.presentation.dto;

/**
 * Error payload {@code { "error": string }} returned with every non-200 response.
 *
 * @param error client-facing message
 */
public record ApiError(String error) {

    public static final String INVALID_REQUEST = "Invalid request";
    public static final String INTERNAL_ERROR = "Internal server error";

    public static ApiError invalidRequest() {
        return new ApiError(INVALID_REQUEST);
    }
}
