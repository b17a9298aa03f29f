package com.portfolioengine.event;

import com.portfolioengine.domain.model.RebalanceProposal;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published at the end of every rebalance cycle with the proposals it produced
 * (possibly none) and how many of them were admitted.
 */
public class RebalanceEvent extends ApplicationEvent {

    private final List<RebalanceProposal> proposals;
    private final int admitted;

    public RebalanceEvent(Object source, List<RebalanceProposal> proposals, int admitted) {
        super(source);
        this.proposals = List.copyOf(proposals);
        this.admitted = admitted;
    }

    public List<RebalanceProposal> getProposals() {
        return proposals;
    }

    public int getAdmitted() {
        return admitted;
    }
}
