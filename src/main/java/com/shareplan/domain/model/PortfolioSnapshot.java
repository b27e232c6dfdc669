package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Parsed portfolio file: allocation rows plus the valuation snapshot it reports
 */
public record PortfolioSnapshot(
        List<PortfolioEntry> entries,
        LocalDate asOfDate,
        BigDecimal marketPrice,
        String currency
) {

    public PortfolioSnapshot {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public boolean hasValuation() {
        return asOfDate != null && marketPrice != null && marketPrice.signum() > 0;
    }
}
