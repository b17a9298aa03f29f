package com.portfolioengine.core.engine;

import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.domain.model.Position;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Holds the open position of one instrument and serialises everything that touches it.
 *
 * <p>Ticks of different instruments run in parallel on the evaluation pool; ticks of the
 * same instrument queue on this lock, so a position is only ever mutated by one thread.
 */
class InstrumentPipeline {

    private final String instrumentId;
    private final ReentrantLock lock = new ReentrantLock();

    private Position position;
    private Decision lastDecision;

    InstrumentPipeline(String instrumentId) {
        this.instrumentId = instrumentId;
    }

    /**
     * Runs one evaluation against the current position and keeps the position the decision
     * hands back. A closed position leaves the pipeline flat.
     */
    Decision apply(Function<Position, Decision> evaluation) {
        lock.lock();
        try {
            Decision decision = evaluation.apply(position);
            Position updated = decision.getPosition();
            position = updated != null && !updated.isClosed() ? updated : null;
            lastDecision = decision;
            return decision;
        } finally {
            lock.unlock();
        }
    }

    <T> T read(Function<Position, T> reader) {
        lock.lock();
        try {
            return reader.apply(position);
        } finally {
            lock.unlock();
        }
    }

    Optional<Decision> getLastDecision() {
        lock.lock();
        try {
            return Optional.ofNullable(lastDecision);
        } finally {
            lock.unlock();
        }
    }

    String getInstrumentId() {
        return instrumentId;
    }
}
