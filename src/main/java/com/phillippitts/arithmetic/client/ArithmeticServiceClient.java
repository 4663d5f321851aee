package com.phillippitts.arithmetic.client;

import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.domain.OperationRequest;
import com.phillippitts.arithmetic.domain.OperationResult;

import java.util.concurrent.CompletableFuture;

/**
 * Client for one arithmetic service.
 *
 * <p>Each {@link #call(OperationRequest)} is a single HTTP round trip with no retry. The returned
 * future completes with the parsed body on a 2xx status, and completes exceptionally with a
 * {@link com.phillippitts.arithmetic.exception.ServiceCallException} otherwise.
 */
public interface ArithmeticServiceClient {

    CompletableFuture<OperationResult> call(OperationRequest request);

    /** The operation served by the service this client talks to. */
    ArithmeticOperation operation();
}
