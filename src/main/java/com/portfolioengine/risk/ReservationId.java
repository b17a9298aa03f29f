package com.portfolioengine.risk;

import java.util.UUID;

public record ReservationId(String value) {

    public static ReservationId next() {
        return new ReservationId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
