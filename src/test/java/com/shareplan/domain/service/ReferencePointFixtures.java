package com.shareplan.domain.service;

import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.OrderType;
import com.shareplan.domain.model.PortfolioEntry;
import com.shareplan.domain.model.ReferencePoint;
import com.shareplan.domain.model.SaleEvent;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

final class ReferencePointFixtures {

    static final String ESPP = "Global Employee Share Purchase Plan";

    private ReferencePointFixtures() {
    }

    static ReferencePoint userPurchase(LocalDate date, String price, String allocated, String outstanding) {
        return purchase(ContributionCategory.USER_INVESTMENT, "Purchase", ESPP, date, Map.of("EUR", new BigDecimal(price)),
                allocated, outstanding, outstanding, null);
    }

    static ReferencePoint purchase(ContributionCategory category, String contributionType, String plan, LocalDate date,
                                   Map<String, BigDecimal> prices, String allocated, String outstanding, String available,
                                   LocalDate availableFrom) {
        PortfolioEntry entry = new PortfolioEntry(plan, contributionType, date, prices.get("EUR"),
                new BigDecimal(allocated), new BigDecimal(outstanding), new BigDecimal(available), availableFrom);
        return ReferencePoint.purchase(entry, category, new BigDecimal(outstanding), new BigDecimal(available), prices, "EUR");
    }

    static ReferencePoint asOfDate(LocalDate date, String price) {
        return ReferencePoint.asOfDate(date, Map.of("EUR", new BigDecimal(price)), "EUR");
    }

    static SaleEvent sale(LocalDate date, String quantity, String price) {
        return new SaleEvent(date, OrderType.SELL, new BigDecimal(quantity), new BigDecimal(price), ESPP,
                Map.of("EUR", new BigDecimal(price)));
    }
}
