package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Valuation reported by the portfolio file, kept apart from the market close of the same date
 *
 * @param historicalClose close from the price history on that date, null when the history had none
 */
public record AsOfDateMarker(LocalDate date, BigDecimal reportedPrice, BigDecimal historicalClose) {

    public BigDecimal timelinePrice() {
        return historicalClose != null ? historicalClose : reportedPrice;
    }

    public boolean hasHistoricalClose() {
        return historicalClose != null;
    }
}
