package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@RegisterForReflection
@Schema(description = "Request to load a parsed portfolio into a calculation session")
public record LoadPortfolioRequest(
    @NotNull(message = "Portfolio is required")
    @Valid
    @Schema(description = "Parsed portfolio file", required = true)
    PortfolioRequest portfolio,

    @Schema(description = "Parsed transaction file")
    List<@Valid TransactionRequest> transactions,

    @Pattern(regexp = "[A-Z]{3}", message = "Display currency must be an ISO 4217 code")
    @Schema(description = "Currency to calculate in, defaults to the portfolio currency", example = "USD")
    String displayCurrency
) {}
