package com.shareplan.domain.model;

import java.time.LocalDate;

/**
 * Non-fatal data problem recorded for diagnostics
 */
public record DataQualityWarning(WarningType type, LocalDate date, String detail) {
}
