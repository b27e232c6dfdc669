package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.math.BigDecimal;
import java.time.LocalDate;

@RegisterForReflection
public record TimelinePointResponse(
    LocalDate date,
    BigDecimal outstandingShares,
    BigDecimal currentPrice,
    BigDecimal portfolioValue,
    BigDecimal profitLoss,
    BigDecimal cumulativeInvestment,
    BigDecimal cumulativeSaleProceeds,
    String reason,
    boolean hasTransaction
) {}
