package com.phillippitts.arithmetic.presentation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.domain.OperationRequest;
import com.phillippitts.arithmetic.domain.OperationResult;
import com.phillippitts.arithmetic.service.OperationHandler;
import com.phillippitts.arithmetic.service.metrics.OperationMetrics;
import com.phillippitts.arithmetic.service.validation.OperationRequestValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * The single endpoint of an arithmetic service: {@code POST /} with {@code {"a": number, "b": number}}.
 *
 * <p>The body is bound as a raw {@link JsonNode} so that type checks are explicit and
 * strings are never coerced to numbers. Validation and constraint failures propagate as
 * domain exceptions and are rendered by {@code GlobalExceptionHandler}.
 */
@RestController
class OperationController {

    private static final Logger LOG = LogManager.getLogger(OperationController.class);

    private final OperationRequestValidator validator;
    private final OperationHandler handler;
    private final OperationMetrics metrics;

    OperationController(OperationRequestValidator validator,
                        OperationHandler handler,
                        OperationMetrics metrics) {
        this.validator = validator;
        this.handler = handler;
        this.metrics = metrics;
    }

    @PostMapping("/")
    ResponseEntity<OperationResult> compute(@RequestBody(required = false) JsonNode body) {
        long start = System.nanoTime();
        OperationRequest request = validator.validate(body);
        ArithmeticOperation operation = handler.getOperation();

        double value = handler.handle(request);

        metrics.recordSuccess(operation, System.nanoTime() - start);
        if (!Double.isFinite(value)) {
            LOG.warn("{}({}, {}) overflowed to {}; returning null result",
                    operation, request.a(), request.b(), value);
        } else {
            LOG.debug("{}({}, {}) = {}", operation, request.a(), request.b(), value);
        }
        return ResponseEntity.ok(OperationResult.of(value));
    }
}
