package com.portfolioengine.event;

import com.portfolioengine.domain.model.Decision;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every actionable decision (ENTER, LADDER, EXIT). The order-execution
 * collaborator listens to this event; the engine itself never submits orders.
 */
public class DecisionEvent extends ApplicationEvent {

    private final Decision decision;

    public DecisionEvent(Object source, Decision decision) {
        super(source);
        this.decision = decision;
    }

    public Decision getDecision() {
        return decision;
    }
}
