package com.shareplan.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Order types that move shares out of the account
 */
public enum OrderType {
    SELL("Sell"),
    SELL_AT_MARKET_PRICE("Sell at market price"),
    SELL_WITH_PRICE_LIMIT("Sell with price limit"),
    TRANSFER("Transfer");

    private final String label;

    OrderType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTransfer() {
        return this == TRANSFER;
    }

    public static Optional<OrderType> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equals(label))
                .findFirst();
    }
}
