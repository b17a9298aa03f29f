package com.portfolioengine.event;

import com.portfolioengine.domain.model.DecisionRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the {@code DecisionLogger} each time a decision record is logged.
 */
public class DecisionLogEvent extends ApplicationEvent {

    private final DecisionRecord decisionRecord;

    public DecisionLogEvent(Object source, DecisionRecord decisionRecord) {
        super(source);
        this.decisionRecord = decisionRecord;
    }

    public DecisionRecord getDecisionRecord() {
        return decisionRecord;
    }
}
