package com.portfolioengine.event;

import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.domain.model.RebalanceProposal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the engine's events.
 *
 * <p>Listener failures are logged and swallowed here: an observer must never turn an
 * admitted decision into a failed tick.
 */
@Component
public class EventPublisherHelper {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherHelper.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Decision ----

    public void publishDecision(Object source, Decision decision) {
        publish(new DecisionEvent(source, decision));
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        publish(new RiskEvent(source, eventType, level, message, details));
    }

    // ---- Rebalance ----

    public void publishRebalanceCycle(Object source, List<RebalanceProposal> proposals, int admitted) {
        publish(new RebalanceEvent(source, proposals, admitted));
    }

    private void publish(Object event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
