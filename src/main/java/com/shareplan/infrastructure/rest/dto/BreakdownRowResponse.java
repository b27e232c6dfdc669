package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.math.BigDecimal;
import java.time.LocalDate;

@RegisterForReflection
public record BreakdownRowResponse(
    boolean total,
    LocalDate date,
    String label,
    BigDecimal shares,
    BigDecimal price,
    BigDecimal amount,
    BigDecimal value,
    BigDecimal percentage,
    Integer count
) {}
