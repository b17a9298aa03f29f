package com.portfolioengine.market;

import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.OrderBookDepth;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Default snapshot and depth source: keeps the latest value pushed for each instrument.
 * The snapshot feed writes here through {@code TickDispatcher}.
 */
@Component
public class InMemoryMarketDataStore implements SnapshotProvider, OrderBookQuery {

    private final Map<String, InstrumentSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, OrderBookDepth> depths = new ConcurrentHashMap<>();

    public void putSnapshot(InstrumentSnapshot snapshot) {
        snapshots.put(snapshot.getInstrumentId(), snapshot);
    }

    public void putDepth(String instrumentId, OrderBookDepth depth) {
        depths.put(instrumentId, depth);
    }

    @Override
    public Optional<InstrumentSnapshot> latest(String instrumentId) {
        return Optional.ofNullable(snapshots.get(instrumentId));
    }

    @Override
    public Optional<OrderBookDepth> depth(String instrumentId) {
        return Optional.ofNullable(depths.get(instrumentId));
    }
}
