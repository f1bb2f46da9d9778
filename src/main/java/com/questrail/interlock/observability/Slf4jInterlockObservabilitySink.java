package com.questrail.interlock.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of InterlockObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jInterlockObservabilitySink implements InterlockObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jInterlockObservabilitySink.class);

    @Override
    public void onStateTransition(InterlockTransitionEvent event) {
        log.info("[{}] Interlock state: {} -> {}",
            event.deviceName(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onFault(InterlockFaultEvent event) {
        switch (event.kind()) {
            case CONFIRMATION_TIMEOUT, INVALID_CONFIG ->
                log.warn("[{}] {}: {}", event.deviceName(), event.kind(), event.message(), event.cause());
            default ->
                log.error("[{}] {}: {}", event.deviceName(), event.kind(), event.message(), event.cause());
        }
    }
}
