package com.portfolioengine.domain.model;

/**
 * Names of the indicator values the engine reads from an {@link InstrumentSnapshot}.
 *
 * <p>Crossover predicates need the value of the previous bar as well. Producers publish
 * those under the same key with a {@code _prev} suffix so that every predicate remains a
 * function of one snapshot.
 */
public final class IndicatorKeys {

    public static final String PREV_SUFFIX = "_prev";

    // Trend
    public static final String ADX = "adx";
    public static final String PLUS_DI = "plus_di";
    public static final String MINUS_DI = "minus_di";
    public static final String EMA_FAST = "ema_fast";
    public static final String EMA_SLOW = "ema_slow";
    public static final String MACD = "macd";
    public static final String MACD_SIGNAL = "macd_signal";

    // Oscillators
    public static final String RSI = "rsi";
    public static final String STOCH_K = "stoch_k";
    public static final String STOCH_D = "stoch_d";

    // Volatility bands
    public static final String BB_LOWER = "bb_lower";
    public static final String BB_UPPER = "bb_upper";
    public static final String BB_WIDTH = "bb_width";
    public static final String BB_POSITION = "bb_position";
    public static final String ATR = "atr";
    public static final String VOLATILITY = "volatility";

    // Volume
    public static final String VOLUME_RATIO = "volume_ratio";

    private IndicatorKeys() {}

    public static String prev(String key) {
        return key + PREV_SUFFIX;
    }
}
