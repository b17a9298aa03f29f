package com.portfolioengine.domain.model;

import com.portfolioengine.exception.DataUnavailableException;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Per-instrument, per-tick bundle of price and precomputed indicator values.
 *
 * <p>Immutable once built. Indicator values keep their insertion order so decision log
 * entries list them the way the producer published them. A value that is absent or NaN
 * is treated as missing.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class InstrumentSnapshot {

    private final String instrumentId;

    /** Category tag used by allocation tracking (e.g. "btc", "alt", "stable"). */
    private final String category;

    private final Instant timestamp;

    /** Last traded price. Zero or negative means the snapshot is degenerate. */
    private final double price;

    @Singular
    private final Map<String, Double> indicators;

    public boolean has(String key) {
        Double value = indicators.get(key);
        return value != null && !value.isNaN();
    }

    public boolean hasAll(String... keys) {
        for (String key : keys) {
            if (!has(key)) {
                return false;
            }
        }
        return true;
    }

    public OptionalDouble find(String key) {
        return has(key) ? OptionalDouble.of(indicators.get(key)) : OptionalDouble.empty();
    }

    /**
     * Returns the indicator value or throws when it is missing.
     *
     * @throws DataUnavailableException if the indicator is absent or NaN
     */
    public double require(String key) {
        if (!has(key)) {
            throw new DataUnavailableException(instrumentId, key);
        }
        return indicators.get(key);
    }

    /** Value of the indicator on the previous bar ({@code key_prev}). */
    public double requirePrevious(String key) {
        return require(IndicatorKeys.prev(key));
    }

    public boolean hasUsablePrice() {
        return price > 0 && !Double.isNaN(price) && !Double.isInfinite(price);
    }
}
