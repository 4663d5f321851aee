package com.phillippitts.arithmetic.service;

import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.domain.OperationRequest;
import com.phillippitts.arithmetic.exception.OperandConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationHandlerTest {

    @Test
    void shouldAdd() {
        assertThat(new OperationHandler(ArithmeticOperation.ADD).handle(OperationRequest.of(1, 2)))
                .isEqualTo(3.0);
    }

    @Test
    void shouldSubtract() {
        assertThat(new OperationHandler(ArithmeticOperation.SUBTRACT).handle(OperationRequest.of(2, 1)))
                .isEqualTo(1.0);
    }

    @Test
    void shouldMultiply() {
        assertThat(new OperationHandler(ArithmeticOperation.MULTIPLY).handle(OperationRequest.of(2, 3)))
                .isEqualTo(6.0);
    }

    @Test
    void shouldDivide() {
        assertThat(new OperationHandler(ArithmeticOperation.DIVIDE).handle(OperationRequest.of(6, 3)))
                .isEqualTo(2.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {6, 0, -6, 1e300})
    void shouldRejectZeroDivisorRegardlessOfDividend(double a) {
        OperationHandler handler = new OperationHandler(ArithmeticOperation.DIVIDE);

        assertThatThrownBy(() -> handler.handle(OperationRequest.of(a, 0)))
                .isInstanceOf(OperandConstraintViolationException.class)
                .hasMessage("Division by zero")
                .satisfies(ex -> assertThat(((OperandConstraintViolationException) ex).getOperation())
                        .isEqualTo(ArithmeticOperation.DIVIDE));
    }

    @Test
    void shouldRejectNegativeZeroDivisor() {
        OperationHandler handler = new OperationHandler(ArithmeticOperation.DIVIDE);

        assertThatThrownBy(() -> handler.handle(OperationRequest.of(6, -0.0)))
                .isInstanceOf(OperandConstraintViolationException.class);
    }

    @Test
    void zeroOperandsAreFineForOtherOperations() {
        assertThat(new OperationHandler(ArithmeticOperation.ADD).handle(OperationRequest.of(5, 0))).isEqualTo(5.0);
        assertThat(new OperationHandler(ArithmeticOperation.MULTIPLY).handle(OperationRequest.of(5, 0))).isEqualTo(0.0);
        assertThat(new OperationHandler(ArithmeticOperation.DIVIDE).handle(OperationRequest.of(0, 5))).isEqualTo(0.0);
    }

    @Test
    void shouldReturnSameResultForRepeatedRequests() {
        OperationHandler handler = new OperationHandler(ArithmeticOperation.DIVIDE);
        OperationRequest request = OperationRequest.of(1, 3);

        double first = handler.handle(request);
        for (int i = 0; i < 100; i++) {
            assertThat(handler.handle(request)).isEqualTo(first);
        }
    }

    @Test
    void shouldPassOverflowThrough() {
        OperationHandler handler = new OperationHandler(ArithmeticOperation.MULTIPLY);

        assertThat(handler.handle(OperationRequest.of(1e308, 10))).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void shouldRejectNullArguments() {
        assertThatThrownBy(() -> new OperationHandler(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new OperationHandler(ArithmeticOperation.ADD).handle(null))
                .isInstanceOf(NullPointerException.class);
    }
}
