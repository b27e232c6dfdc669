package com.shareplan.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one portfolio calculation, expressed in {@link #currency()}
 */
@Builder(toBuilder = true)
public record Calculations(
        BigDecimal userInvestment,
        BigDecimal companyMatch,
        BigDecimal freeShares,
        BigDecimal companyInvestment,
        BigDecimal dividendIncome,
        BigDecimal totalInvestment,
        BigDecimal totalSold,
        BigDecimal currentValue,
        BigDecimal totalValue,
        BigDecimal totalReturn,
        BigDecimal returnPercentage,
        BigDecimal returnOnTotalInvestment,
        BigDecimal returnPercentageOnTotalInvestment,
        BigDecimal xirrUserInvestment,
        BigDecimal xirrTotalInvestment,
        BigDecimal availableShares,
        BlockedShares blockedShares,
        BigDecimal totalShares,
        BigDecimal currentPrice,
        PriceSource priceSource,
        LocalDate priceDate,
        String currency,
        List<DataQualityWarning> warnings,
        Map<BreakdownMetric, List<BreakdownRow>> breakdowns,
        Instant calculatedAt
) {

    public Calculations {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        breakdowns = breakdowns != null ? Map.copyOf(breakdowns) : Map.of();
    }

    public List<BreakdownRow> breakdown(BreakdownMetric metric) {
        return breakdowns.getOrDefault(metric, List.of());
    }
}
