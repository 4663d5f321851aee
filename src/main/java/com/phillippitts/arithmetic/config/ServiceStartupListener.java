package com.phillippitts.arithmetic.config;

import com.phillippitts.arithmetic.config.properties.ArithmeticServiceProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Announces the served operation once the embedded server is listening.
 */
@Component
class ServiceStartupListener {

    private static final Logger LOG = LogManager.getLogger(ServiceStartupListener.class);

    private final ArithmeticServiceProperties properties;

    ServiceStartupListener(ArithmeticServiceProperties properties) {
        this.properties = properties;
    }

    @EventListener
    void onWebServerInitialized(WebServerInitializedEvent event) {
        // Actuator may run a separate management server; only the application port is announced
        if (event.getApplicationContext().getServerNamespace() != null) {
            return;
        }
        LOG.info("{} Service listening on port {}",
                properties.getOperation().getServiceName(), event.getWebServer().getPort());
    }
}
