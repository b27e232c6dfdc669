package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.math.BigDecimal;
import java.util.Map;

@RegisterForReflection
public record BlockedSharesResponse(
    BigDecimal total,
    Map<Integer, BigDecimal> byYear
) {}
