package com.phillippitts.arithmetic.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.arithmetic.domain.ArithmeticOperation;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Factory methods for {@link ArithmeticServiceClient} instances.
 *
 * <pre>
 * ArithmeticServiceClient divider = ArithmeticServiceClients.divider("http://127.0.0.1:3003");
 * double quotient = divider.call(OperationRequest.of(6, 3)).join().result();
 * </pre>
 */
public final class ArithmeticServiceClients {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ArithmeticServiceClients() {}

    public static ArithmeticServiceClient adder(String baseUrl) {
        return forOperation(ArithmeticOperation.ADD, baseUrl);
    }

    public static ArithmeticServiceClient subtractor(String baseUrl) {
        return forOperation(ArithmeticOperation.SUBTRACT, baseUrl);
    }

    public static ArithmeticServiceClient multiplier(String baseUrl) {
        return forOperation(ArithmeticOperation.MULTIPLY, baseUrl);
    }

    public static ArithmeticServiceClient divider(String baseUrl) {
        return forOperation(ArithmeticOperation.DIVIDE, baseUrl);
    }

    /**
     * Creates a client with its own default {@link HttpClient}.
     *
     * @throws IllegalArgumentException if {@code baseUrl} is not a valid URI
     */
    public static ArithmeticServiceClient forOperation(ArithmeticOperation operation, String baseUrl) {
        return forOperation(operation, baseUrl, HttpClient.newHttpClient());
    }

    /**
     * Creates a client sharing the given transport, e.g. one configured with a connect timeout.
     */
    public static ArithmeticServiceClient forOperation(ArithmeticOperation operation, String baseUrl,
                                                       HttpClient httpClient) {
        return new HttpArithmeticServiceClient(operation, URI.create(baseUrl), httpClient, MAPPER);
    }
}
