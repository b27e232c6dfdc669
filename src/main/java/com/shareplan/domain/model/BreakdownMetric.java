package com.shareplan.domain.model;

/**
 * Metrics that carry an audit table in {@link Calculations#breakdowns()}
 */
public enum BreakdownMetric {
    USER_INVESTMENT,
    COMPANY_MATCH,
    FREE_SHARES,
    DIVIDEND_INCOME,
    TOTAL_INVESTMENT,
    CURRENT_PORTFOLIO,
    TOTAL_SOLD,
    XIRR_USER_INVESTMENT,
    XIRR_TOTAL_INVESTMENT
}
