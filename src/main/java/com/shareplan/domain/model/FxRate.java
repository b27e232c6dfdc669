package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Exchange rates of one date, quoted as units of currency per one EUR
 */
public record FxRate(LocalDate date, Map<String, BigDecimal> rates) {

    public static final String BASE_CURRENCY = "EUR";

    public FxRate {
        rates = rates != null ? Map.copyOf(rates) : Map.of();
    }

    /**
     * Rate of the currency against EUR; EUR itself is always 1. Returns null for unknown
     * or non-positive rates.
     */
    public BigDecimal rateFor(String currency) {
        if (BASE_CURRENCY.equals(currency)) {
            return BigDecimal.ONE;
        }
        BigDecimal rate = rates.get(currency);
        return rate != null && rate.signum() > 0 ? rate : null;
    }
}
