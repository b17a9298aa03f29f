package com.portfolioengine.domain.model;

import java.util.Locale;

/**
 * Instrument id helpers. Ids are pairs such as "BTC/USDT"; an id without a separator is
 * its own base asset.
 */
public final class AssetSymbols {

    private AssetSymbols() {}

    /** Upper-case base asset of an instrument id ("BTC" for "btc/usdt"), or null for a blank id. */
    public static String baseAsset(String instrumentId) {
        if (instrumentId == null || instrumentId.isBlank()) {
            return null;
        }
        int separator = instrumentId.indexOf('/');
        return (separator > 0 ? instrumentId.substring(0, separator) : instrumentId).toUpperCase(Locale.ROOT);
    }
}
