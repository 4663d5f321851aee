package com.phillippitts.arithmetic.exception;

import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void invalidRequestKeepsReason() {
        InvalidOperationRequestException ex = new InvalidOperationRequestException("Field 'a' is missing");

        assertThat(ex).isInstanceOf(ArithmeticServicesException.class);
        assertThat(ex.getReason()).isEqualTo("Field 'a' is missing");
        assertThat(ex.getMessage()).contains("Field 'a' is missing");
    }

    @Test
    void constraintViolationMessageIsClientFacing() {
        OperandConstraintViolationException ex =
                new OperandConstraintViolationException(ArithmeticOperation.DIVIDE, "Division by zero");

        assertThat(ex).isInstanceOf(ArithmeticServicesException.class);
        assertThat(ex.getMessage()).isEqualTo("Division by zero");
        assertThat(ex.getOperation()).isEqualTo(ArithmeticOperation.DIVIDE);
    }

    @Test
    void serviceCallExceptionDescribesServiceAndStatus() {
        ServiceCallException ex = new ServiceCallException("Divider", 400, null);

        assertThat(ex.getMessage()).isEqualTo("Divider Service returned status 400");
        assertThat(ex.getServiceName()).isEqualTo("Divider");
        assertThat(ex.getStatusCode()).isEqualTo(400);
        assertThat(ex.getErrorMessage()).isNull();
        assertThat(ex.isTransportFailure()).isFalse();
    }

    @Test
    void serviceCallExceptionAppendsErrorMessage() {
        ServiceCallException ex = new ServiceCallException("Divider", 400, "Division by zero");

        assertThat(ex.getMessage()).isEqualTo("Divider Service returned status 400: Division by zero");
        assertThat(ex.getErrorMessage()).isEqualTo("Division by zero");
    }

    @Test
    void serviceCallExceptionWrapsTransportFailure() {
        ConnectException cause = new ConnectException("Connection refused");
        ServiceCallException ex = new ServiceCallException("Adder", cause);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getStatusCode()).isZero();
        assertThat(ex.isTransportFailure()).isTrue();
        assertThat(ex.getMessage()).contains("Adder Service").contains("Connection refused");
    }
}
