package com.portfolioengine.domain.model;

import com.portfolioengine.domain.enums.DecisionOutcome;
import com.portfolioengine.domain.enums.DecisionSeverity;
import com.portfolioengine.domain.enums.DecisionSource;
import com.portfolioengine.domain.enums.DecisionType;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Structured decision log entry.
 *
 * <p>Every admitted, rejected or failed decision is captured with the reasoning and the
 * indicator values it was based on, so a tick can be explained after the fact without
 * re-running it.
 */
@Data
@Builder
public class DecisionRecord {

    private Instant timestamp;

    private DecisionSource source;

    /** Instrument id, reservation id or category the decision relates to. */
    private String subject;

    private DecisionType decisionType;

    private DecisionOutcome outcome;

    private String reasoning;

    /** Example keys: regime, stake, stopLevel, violations, utilization. */
    private Map<String, Object> dataContext;

    private DecisionSeverity severity;
}
