package com.portfolioengine.market;

import com.portfolioengine.domain.model.InstrumentSnapshot;
import java.util.Optional;

/**
 * Supplies the latest already-computed indicator snapshot per instrument.
 */
public interface SnapshotProvider {

    Optional<InstrumentSnapshot> latest(String instrumentId);
}
