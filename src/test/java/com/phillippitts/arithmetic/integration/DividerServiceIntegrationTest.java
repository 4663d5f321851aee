package com.phillippitts.arithmetic.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.domain.OperationRequest;
import com.phillippitts.arithmetic.exception.ServiceCallException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ActiveProfiles("divider")
class DividerServiceIntegrationTest extends AbstractServiceIntegrationTest {

    @Override
    protected ArithmeticOperation operation() {
        return ArithmeticOperation.DIVIDE;
    }

    @Test
    void shouldCorrectlyDivideSixByThree() throws Exception {
        assertThat(call(6, 3).result()).isEqualTo(2.0);
    }

    @Test
    void shouldReturnAnErrorWhenDividingByZero() {
        assertThatThrownBy(() -> client().call(OperationRequest.of(6, 0)).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(ServiceCallException.class)
                .hasMessage("Divider Service returned status 400: Division by zero");
    }

    @Test
    void shouldRejectZeroDivisorWithSpecificMessage() {
        assertError(postJson("{\"a\":6,\"b\":0}"), HttpStatus.BAD_REQUEST, "Division by zero");
        assertError(postJson("{\"a\":0,\"b\":0}"), HttpStatus.BAD_REQUEST, "Division by zero");
        assertError(postJson("{\"a\":6,\"b\":-0.0}"), HttpStatus.BAD_REQUEST, "Division by zero");
    }

    @Test
    void shouldValidateBeforeCheckingDivisor() {
        assertError(postJson("{\"a\":\"x\",\"b\":0}"), HttpStatus.BAD_REQUEST, "Invalid request");
    }

    @Test
    void shouldAllowZeroDividend() throws Exception {
        assertThat(call(0, 5).result()).isEqualTo(0.0);
    }

    @Test
    void shouldReportServedOperationInActuatorInfo() {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity(baseUrl() + "/actuator/info", JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode service = response.getBody().get("service");
        assertThat(service.get("name").asText()).isEqualTo("Divider");
        assertThat(service.get("operation").asText()).isEqualTo("DIVIDE");
        assertThat(service.get("portVariable").asText()).isEqualTo("DIVIDER_SERVICE_PORT");
    }
}
