package com.shareplan.domain.model;

/**
 * Origin of a price: market close from the price history, the portfolio file's
 * as-of-date valuation, or a manual override entered by the user
 */
public enum PriceSource {
    HISTORICAL,
    AS_OF_DATE,
    MANUAL
}
