package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.PositiveOrZero;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDate;

@RegisterForReflection
@Schema(description = "Allocation row of the portfolio file")
public record PortfolioEntryRequest(
    @Schema(description = "Share plan the allocation belongs to", example = "Global Employee Share Purchase Plan")
    String plan,

    @Schema(description = "How the shares were acquired", example = "Purchase")
    String contributionType,

    @Schema(description = "Allocation date", example = "2020-01-01")
    LocalDate allocationDate,

    @PositiveOrZero(message = "Cost basis cannot be negative")
    @Schema(description = "Acquisition price per share in the portfolio currency", example = "10.00")
    BigDecimal costBasis,

    @PositiveOrZero(message = "Allocated quantity cannot be negative")
    @Schema(description = "Shares originally allocated; the outstanding quantity is used when absent", example = "100")
    BigDecimal allocatedQuantity,

    @PositiveOrZero(message = "Outstanding quantity cannot be negative")
    @Schema(description = "Outstanding quantity as reported by the file", example = "60")
    BigDecimal outstandingQuantity,

    @PositiveOrZero(message = "Available quantity cannot be negative")
    @Schema(description = "Shares that can be sold today", example = "60")
    BigDecimal availableQuantity,

    @Schema(description = "Date the shares unlock", example = "2025-01-01")
    LocalDate availableFrom
) {}
