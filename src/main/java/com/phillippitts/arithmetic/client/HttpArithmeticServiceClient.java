package com.phillippitts.arithmetic.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.domain.OperationRequest;
import com.phillippitts.arithmetic.domain.OperationResult;
import com.phillippitts.arithmetic.exception.ServiceCallException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link ArithmeticServiceClient} over the JDK {@link HttpClient}.
 *
 * <p>Serializes the request as JSON and POSTs it to the base URL with
 * {@code Content-Type: application/json}. Timeouts, pooling and redirects are whatever the
 * supplied {@link HttpClient} is configured with.
 */
class HttpArithmeticServiceClient implements ArithmeticServiceClient {

    private static final Logger LOG = LogManager.getLogger(HttpArithmeticServiceClient.class);

    static final String CONTENT_TYPE = "application/json";

    private final ArithmeticOperation operation;
    private final URI baseUri;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    HttpArithmeticServiceClient(ArithmeticOperation operation, URI baseUri,
                                HttpClient httpClient, ObjectMapper mapper) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public CompletableFuture<OperationResult> call(OperationRequest request) {
        Objects.requireNonNull(request, "request");
        String serviceName = operation.getServiceName();

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder(baseUri)
                    .header("Content-Type", CONTENT_TYPE)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(request)))
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new ServiceCallException(serviceName, e));
        }

        LOG.debug("Calling {} Service at {} with a={}, b={}", serviceName, baseUri, request.a(), request.b());
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, failure) -> {
                    if (failure != null) {
                        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                                ? failure.getCause() : failure;
                        throw new ServiceCallException(serviceName, cause);
                    }
                    return toResult(response);
                });
    }

    private OperationResult toResult(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ServiceCallException(operation.getServiceName(), status, errorMessage(response.body()));
        }
        try {
            return mapper.readValue(response.body(), OperationResult.class);
        } catch (JsonProcessingException e) {
            throw new ServiceCallException(operation.getServiceName(), e);
        }
    }

    /**
     * Extracts {@code error} from a {@code {"error": "..."}} body; {@code null} for anything else.
     */
    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = mapper.readTree(body).get("error");
            return error != null && error.isTextual() ? error.asText() : null;
        } catch (JsonProcessingException e) {
            LOG.debug("{} Service error body is not JSON", operation.getServiceName());
            return null;
        }
    }

    @Override
    public ArithmeticOperation operation() {
        return operation;
    }

    URI baseUri() {
        return baseUri;
    }
}
