package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RegisterForReflection
@Schema(description = "Portfolio metrics in the active currency")
public record CalculationsResponse(
    String currency,
    List<String> availableCurrencies,
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
    @Schema(description = "Total return in percent of the user investment")
    BigDecimal returnPercentage,
    BigDecimal returnOnTotalInvestment,
    BigDecimal returnPercentageOnTotalInvestment,
    @Schema(description = "Annualized return of the user's own cash flows, in percent")
    BigDecimal xirrUserInvestment,
    @Schema(description = "Annualized return of all contributions, in percent")
    BigDecimal xirrTotalInvestment,
    BigDecimal availableShares,
    BlockedSharesResponse blockedShares,
    BigDecimal totalShares,
    BigDecimal currentPrice,
    @Schema(description = "Where the valuation price came from", example = "HISTORICAL")
    String priceSource,
    LocalDate priceDate,
    List<WarningResponse> warnings,
    Map<String, List<BreakdownRowResponse>> breakdowns,
    Instant calculatedAt
) {}
