package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TimelinePoint(
        LocalDate date,
        BigDecimal outstandingShares,
        BigDecimal currentPrice,
        BigDecimal portfolioValue,
        BigDecimal profitLoss,
        BigDecimal cumulativeInvestment,
        BigDecimal cumulativeSaleProceeds,
        String reason,
        boolean hasTransaction
) {
}
