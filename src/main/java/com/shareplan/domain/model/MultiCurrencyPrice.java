package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * One date of the multi-currency price table: the instrument's close in every stored currency
 */
public record MultiCurrencyPrice(LocalDate date, Map<String, BigDecimal> prices) {

    public MultiCurrencyPrice {
        prices = prices != null ? Map.copyOf(prices) : Map.of();
    }

    public BigDecimal priceIn(String currency) {
        return prices.get(currency);
    }
}
