package com.phillippitts.arithmetic;

import com.phillippitts.arithmetic.config.properties.ArithmeticServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Runs one arithmetic service. The service is chosen by profile:
 * <pre>
 * java -jar arithmetic-services.jar --spring.profiles.active=divider
 * </pre>
 * Without a profile the Adder service is started.
 */
@SpringBootApplication
@EnableConfigurationProperties(ArithmeticServiceProperties.class)
public class ArithmeticServicesApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArithmeticServicesApplication.class, args);
    }

}
