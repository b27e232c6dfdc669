package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PricePoint(LocalDate date, BigDecimal price, PriceSource source) {

    public static PricePoint historical(LocalDate date, BigDecimal price) {
        return new PricePoint(date, price, PriceSource.HISTORICAL);
    }
}
