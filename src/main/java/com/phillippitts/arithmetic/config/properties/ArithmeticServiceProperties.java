package com.phillippitts.arithmetic.config.properties;

import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties selecting which operation this process serves.
 *
 * <p>Each service profile ({@code application-adder.properties}, ...) sets
 * {@code arithmetic.service.operation}; without a profile the process serves {@code ADD}.
 */
@Validated
@ConfigurationProperties(prefix = "arithmetic.service")
public class ArithmeticServiceProperties {

    @NotNull
    private final ArithmeticOperation operation;

    @ConstructorBinding
    public ArithmeticServiceProperties(ArithmeticOperation operation) {
        this.operation = operation == null ? ArithmeticOperation.ADD : operation;
    }

    public ArithmeticOperation getOperation() {
        return operation;
    }
}
