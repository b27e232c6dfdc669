package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Price used to value outstanding shares, with where it came from and the date it applies to
 */
public record ValuationPrice(BigDecimal price, PriceSource source, LocalDate date) {
}
