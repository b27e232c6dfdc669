package com.shareplan.domain.model;

public enum CashFlowKind {
    USER_INVESTMENT,
    COMPANY_MATCH,
    FREE_SHARES,
    DIVIDEND_INCOME,
    SALE,
    CURRENT_VALUE;

    public static CashFlowKind of(ContributionCategory category) {
        return switch (category) {
            case USER_INVESTMENT -> USER_INVESTMENT;
            case COMPANY_MATCH -> COMPANY_MATCH;
            case FREE_SHARES -> FREE_SHARES;
            case DIVIDEND_INCOME -> DIVIDEND_INCOME;
            case UNCLASSIFIED -> throw new IllegalArgumentException("Unclassified points carry no cash flow");
        };
    }

    public boolean isOutflow() {
        return this != SALE && this != CURRENT_VALUE;
    }
}
