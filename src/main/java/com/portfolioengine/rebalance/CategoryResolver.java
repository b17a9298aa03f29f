package com.portfolioengine.rebalance;

import com.portfolioengine.domain.model.AssetSymbols;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import org.springframework.stereotype.Component;

/**
 * Maps an instrument to its allocation category.
 *
 * <p>The category tag on the snapshot wins. Otherwise the base asset of the instrument id
 * ("BTC" in "BTC/USDT") is looked up in {@code engine.rebalance.asset-categories}.
 */
@Component
public class CategoryResolver {

    private final RebalanceConfig rebalanceConfig;

    public CategoryResolver(RebalanceConfig rebalanceConfig) {
        this.rebalanceConfig = rebalanceConfig;
    }

    public String resolve(InstrumentSnapshot snapshot) {
        if (snapshot.getCategory() != null && !snapshot.getCategory().isBlank()) {
            return snapshot.getCategory();
        }
        return resolve(snapshot.getInstrumentId());
    }

    public String resolve(String instrumentId) {
        String base = AssetSymbols.baseAsset(instrumentId);
        if (base == null) {
            return rebalanceConfig.getDefaultCategory();
        }
        return rebalanceConfig.getAssetCategories().getOrDefault(base, rebalanceConfig.getDefaultCategory());
    }
}
