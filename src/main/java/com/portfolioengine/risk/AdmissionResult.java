package com.portfolioengine.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of a {@link TradeAdmissionGate} check.
 *
 * <p>Either APPROVED (empty violations list) or REJECTED (one or more violations). When
 * rejected, all violations are included so the decision log shows the complete picture
 * rather than only the first failure.
 */
@Getter
public class AdmissionResult {

    private final boolean approved;
    private final List<RiskViolation> violations;

    private AdmissionResult(boolean approved, List<RiskViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static AdmissionResult approved() {
        return new AdmissionResult(true, Collections.emptyList());
    }

    public static AdmissionResult rejected(List<RiskViolation> violations) {
        return new AdmissionResult(false, List.copyOf(violations));
    }

    public boolean isRejected() {
        return !approved;
    }

    public boolean hasViolation(String code) {
        return violations.stream().anyMatch(v -> v.getCode().equals(code));
    }
}
