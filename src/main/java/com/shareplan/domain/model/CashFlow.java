package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Dated cash flow for XIRR: negative amounts leave the investor, positive amounts return
 */
public record CashFlow(LocalDate date, BigDecimal amount, CashFlowKind kind, String description) {
}
