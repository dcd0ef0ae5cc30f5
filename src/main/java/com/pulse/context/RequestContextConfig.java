package com.pulse.context;

import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Bridges the ambient request context into Reactor pipelines at startup.
 */
@Configuration
public class RequestContextConfig {

    @PostConstruct
    public void enablePropagation() {
        AmbientRequestContext.enableReactivePropagation();
    }
}
