package com.questrail.courier.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CourierObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCourierObservabilitySink implements CourierObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCourierObservabilitySink.class);

    @Override
    public void onStateTransition(RequesterStateTransitionEvent event) {
        if (event.isConnectionChange()) {
            log.info("[{}] Connection: {} -> {} (reply address {})",
                event.component(),
                event.oldState().connection(),
                event.newState().connection(),
                event.newState().replyAddress().orElse("none"));
        }
        if (log.isTraceEnabled()) {
            log.trace("[{}] {} -> {} intent(s), {} pending",
                event.component(),
                event.triggeringEvent().getClass().getSimpleName(),
                event.resultingIntents().size(),
                event.newState().table().size());
        }
    }

    @Override
    public void onProtocolEvent(CourierProtocolEvent event) {
        switch (event.kind()) {
            case UNMATCHED_DELIVERY, UNMATCHED_RETURN, PENDING_CLEARED, PUBLISH_FAILED, PROCESSING_FAILED, STALE_BINDING ->
                log.warn("[{}] {} correlationId={}: {}",
                    event.component(), event.kind(), event.correlationId(), event.detail());
            default ->
                log.debug("[{}] {} correlationId={}: {}",
                    event.component(), event.kind(), event.correlationId(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(CourierTransportEvent event) {
        if (event.up()) {
            log.info("[{}] Broker channel up", event.component());
        } else if (event.cause() != null) {
            log.warn("[{}] Broker channel down: {}", event.component(), event.cause().toString());
        } else {
            log.info("[{}] Broker channel down", event.component());
        }
    }

    @Override
    public void onError(CourierErrorEvent event) {
        log.error("Courier Error: {}", event.message(), event.cause());
    }
}
