package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Executed sale or transfer, with its execution price pre-computed in every convertible currency
 *
 * @param quantity absolute number of shares leaving the account
 */
public record SaleEvent(
        LocalDate date,
        OrderType orderType,
        BigDecimal quantity,
        BigDecimal executionPrice,
        String plan,
        Map<String, BigDecimal> pricesByCurrency
) {

    public SaleEvent {
        quantity = quantity != null ? quantity.abs() : BigDecimal.ZERO;
        executionPrice = executionPrice != null ? executionPrice : BigDecimal.ZERO;
        pricesByCurrency = pricesByCurrency != null ? Map.copyOf(pricesByCurrency) : Map.of();
    }

    public BigDecimal priceIn(String currency) {
        return currency != null ? pricesByCurrency.get(currency) : null;
    }

    /**
     * Proceeds in the given currency, or null when the execution price is not convertible to it
     */
    public BigDecimal proceedsIn(String currency) {
        BigDecimal price = priceIn(currency);
        return price != null ? quantity.multiply(price) : null;
    }
}
