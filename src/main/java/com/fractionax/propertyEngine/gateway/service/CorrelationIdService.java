package com.fractionax.propertyEngine.gateway.service;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Issues per-request correlation IDs and binds them to the logging MDC.
 * Provider calls on worker threads pick the ID up through {@code MdcAwareExecutor}.
 */
@Service
public class CorrelationIdService {

    /**
     * MDC key the logging pattern prints on every line.
     */
    public static final String MDC_KEY = "correlationId";

    public String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Generates a correlation ID and puts it on the current thread's MDC.
     * Callers must pair this with {@link #unbind()}.
     *
     * @return The bound correlation ID
     */
    public String bindNew() {
        String correlationId = generateCorrelationId();
        MDC.put(MDC_KEY, correlationId);
        return correlationId;
    }

    public void unbind() {
        MDC.remove(MDC_KEY);
    }
}
