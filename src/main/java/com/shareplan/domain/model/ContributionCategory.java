package com.shareplan.domain.model;

/**
 * Closed set of investment categories a reference point can belong to.
 * Classification happens once, when reference points are built.
 */
public enum ContributionCategory {
    USER_INVESTMENT,
    COMPANY_MATCH,
    FREE_SHARES,
    DIVIDEND_INCOME,
    UNCLASSIFIED;

    static final String SHARE_PURCHASE_PLAN_SUFFIX = "Employee Share Purchase Plan";
    static final String DIVIDEND_REINVESTMENT_SUFFIX = "Dividend Reinvestment";
    static final String FREE_SHARE_PLAN = "Free Share";

    /**
     * Matches the plan and contribution type strings of the share-plan files (case-sensitive)
     */
    public static ContributionCategory classify(String contributionType, String plan) {
        String safePlan = plan != null ? plan : "";

        if ("Purchase".equals(contributionType) && safePlan.endsWith(SHARE_PURCHASE_PLAN_SUFFIX)) {
            return USER_INVESTMENT;
        }
        if ("Company match".equals(contributionType) && safePlan.endsWith(SHARE_PURCHASE_PLAN_SUFFIX)) {
            return COMPANY_MATCH;
        }
        if ("Award".equals(contributionType) && FREE_SHARE_PLAN.equals(safePlan)) {
            return FREE_SHARES;
        }
        if (safePlan.endsWith(DIVIDEND_REINVESTMENT_SUFFIX)) {
            return DIVIDEND_INCOME;
        }
        return UNCLASSIFIED;
    }

    public boolean isClassified() {
        return this != UNCLASSIFIED;
    }
}
