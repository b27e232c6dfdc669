package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.math.BigDecimal;
import java.time.LocalDate;

@RegisterForReflection
public record AsOfDateMarkerResponse(
    LocalDate date,
    BigDecimal reportedPrice,
    BigDecimal historicalClose
) {}
