package com.phillippitts.arithmetic.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@ActiveProfiles("adder")
class AdderServiceIntegrationTest extends AbstractServiceIntegrationTest {

    @Autowired
    private MeterRegistry meterRegistry;

    @Override
    protected ArithmeticOperation operation() {
        return ArithmeticOperation.ADD;
    }

    @Test
    void shouldCorrectlyAddOnePlusTwo() throws Exception {
        assertThat(call(1, 2).result()).isEqualTo(3.0);
    }

    @Test
    void shouldAddNegativesAndFractions() throws Exception {
        assertThat(call(-1.5, 0.25).result()).isEqualTo(-1.25);
        assertThat(call(0.1, 0.2).result()).isEqualTo(0.1 + 0.2);
    }

    @Test
    void shouldAnswerRawRequestWith200() {
        ResponseEntity<JsonNode> response = postJson("{\"a\":1,\"b\":2}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().get("result").asDouble()).isEqualTo(3.0);
    }

    @Test
    void shouldCountSuccessfulComputations() throws Exception {
        double before = successCount();

        call(2, 2);

        assertThat(successCount()).isEqualTo(before + 1);
    }

    private double successCount() {
        var counter = meterRegistry.find("arithmetic.operation.success").tag("operation", "add").counter();
        return counter == null ? 0.0 : counter.count();
    }
}
