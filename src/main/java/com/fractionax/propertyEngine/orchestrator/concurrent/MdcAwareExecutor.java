package com.fractionax.propertyEngine.orchestrator.concurrent;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bounded executor for provider calls that carries the caller's MDC (correlationId)
 * into the worker thread.
 */
@Slf4j
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /**
     * Stops accepting work and waits briefly for running provider calls.
     */
    public void shutdown() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Provider executor did not terminate in time, forcing shutdown");
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
