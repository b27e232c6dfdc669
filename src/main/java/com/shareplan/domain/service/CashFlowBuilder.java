package com.shareplan.domain.service;

import com.shareplan.domain.model.CashFlow;
import com.shareplan.domain.model.CashFlowKind;
import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.ReferencePoint;
import com.shareplan.domain.model.ReferencePointSet;
import com.shareplan.domain.model.SaleEvent;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Builds the dated cash flows the XIRR figures are computed from, in the active currency.
 * Points without an active price are left out.
 */
public class CashFlowBuilder {

    public List<CashFlow> userCashFlows(ReferencePointSet points, List<SaleEvent> sales, BigDecimal currentValue, LocalDate today) {
        return cashFlows(points, sales, currentValue, today,
                point -> point.category() == ContributionCategory.USER_INVESTMENT);
    }

    public List<CashFlow> totalCashFlows(ReferencePointSet points, List<SaleEvent> sales, BigDecimal currentValue, LocalDate today) {
        return cashFlows(points, sales, currentValue, today,
                point -> point.category().isClassified());
    }

    private List<CashFlow> cashFlows(ReferencePointSet points,
                                     List<SaleEvent> sales,
                                     BigDecimal currentValue,
                                     LocalDate today,
                                     Predicate<ReferencePoint> included) {
        List<CashFlow> flows = new ArrayList<>();

        for (ReferencePoint point : points.purchases()) {
            BigDecimal price = points.currentPrice(point);
            if (!included.test(point) || price == null || point.allocatedQuantity().signum() <= 0) {
                continue;
            }
            flows.add(new CashFlow(
                    point.date(),
                    price.multiply(point.allocatedQuantity()).negate(),
                    CashFlowKind.of(point.category()),
                    "%s: %s shares".formatted(point.contributionType(), point.allocatedQuantity().stripTrailingZeros().toPlainString())));
        }

        if (sales != null) {
            for (SaleEvent sale : sales) {
                BigDecimal proceeds = sale.proceedsIn(points.currency());
                if (proceeds == null) {
                    continue;
                }
                flows.add(new CashFlow(
                        sale.date(),
                        proceeds,
                        CashFlowKind.SALE,
                        "%s: %s shares".formatted(sale.orderType().getLabel(), sale.quantity().stripTrailingZeros().toPlainString())));
            }
        }

        if (currentValue != null && currentValue.signum() > 0) {
            flows.add(new CashFlow(today, currentValue, CashFlowKind.CURRENT_VALUE, "Current portfolio value"));
        }

        flows.sort(Comparator.comparing(CashFlow::date));
        return flows;
    }
}
