package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@RegisterForReflection
@Schema(description = "Loaded portfolio session")
public record PortfolioSessionResponse(
    UUID sessionId,
    String currency,
    List<String> availableCurrencies,
    List<WarningResponse> warnings
) {}
