package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.LocalDate;

@RegisterForReflection
public record WarningResponse(
    String type,
    LocalDate date,
    String detail
) {}
