package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.math.BigDecimal;

@RegisterForReflection
@Schema(description = "Request to recalculate a loaded portfolio under a different currency or price")
public record RecalculateRequest(
    @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code")
    @Schema(description = "New active currency", example = "USD")
    String currency,

    @DecimalMin(value = "0.0001", inclusive = true, message = "Manual price must be positive")
    @Schema(description = "Scenario price per share in the active currency", example = "30.00")
    BigDecimal manualPrice,

    @Schema(description = "Drop the scenario price and value at market prices again")
    Boolean clearManualPrice
) {}
