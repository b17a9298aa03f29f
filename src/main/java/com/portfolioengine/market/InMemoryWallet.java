package com.portfolioengine.market;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Default wallet: a balance seeded from {@code engine.wallet.initial-capital} and updated by
 * whoever reconciles the exchange account.
 */
@Component
public class InMemoryWallet implements WalletQuery {

    private final AtomicReference<BigDecimal> capital;

    public InMemoryWallet(@Value("${engine.wallet.initial-capital:0}") BigDecimal initialCapital) {
        this.capital = new AtomicReference<>(initialCapital);
    }

    public void update(BigDecimal totalCapital) {
        capital.set(totalCapital != null ? totalCapital : BigDecimal.ZERO);
    }

    @Override
    public BigDecimal totalCapital() {
        return capital.get();
    }
}
