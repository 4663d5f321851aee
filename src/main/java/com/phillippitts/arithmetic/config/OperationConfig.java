package com.phillippitts.arithmetic.config;

import com.phillippitts.arithmetic.config.properties.ArithmeticServiceProperties;
import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.service.OperationHandler;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Wires the single {@link OperationHandler} this process serves, chosen by
 * {@code arithmetic.service.operation}.
 */
@Configuration
public class OperationConfig {

    @Bean
    public OperationHandler operationHandler(ArithmeticServiceProperties properties) {
        return new OperationHandler(properties.getOperation());
    }

    /**
     * Publishes the served operation under {@code /actuator/info}.
     */
    @Bean
    public InfoContributor operationInfoContributor(ArithmeticServiceProperties properties) {
        ArithmeticOperation operation = properties.getOperation();
        return builder -> builder.withDetail("service", Map.of(
                "name", operation.getServiceName(),
                "operation", operation.name(),
                "portVariable", operation.getPortVariable()
        ));
    }
}
