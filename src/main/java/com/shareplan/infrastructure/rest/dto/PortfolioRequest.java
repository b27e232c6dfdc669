package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@RegisterForReflection
@Schema(description = "Parsed portfolio file")
public record PortfolioRequest(
    @NotNull(message = "Entries are required")
    @Schema(description = "Allocation rows", required = true)
    List<@Valid PortfolioEntryRequest> entries,

    @Schema(description = "Valuation date reported by the file", example = "2024-03-15")
    LocalDate asOfDate,

    @Positive(message = "Market price must be positive")
    @Schema(description = "Valuation price reported by the file", example = "25.00")
    BigDecimal marketPrice,

    @NotNull(message = "Currency is required")
    @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code")
    @Schema(description = "Currency the file is expressed in", example = "EUR", required = true)
    String currency
) {}
