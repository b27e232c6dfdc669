package com.shareplan.domain.service;

import com.shareplan.domain.model.BreakdownRow;
import com.shareplan.domain.model.CashFlow;
import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.ReferencePoint;
import com.shareplan.domain.model.ReferencePointSet;
import com.shareplan.domain.model.SaleEvent;
import com.shareplan.domain.model.ValuationPrice;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit tables behind the headline metrics. Every table ends with exactly one total row.
 */
public class BreakdownGenerator {

    public static final String VALUE_AT_AS_OF_DATE = "VALUE_AT_AS_OF_DATE";
    public static final String VALUE_TODAY = "VALUE_TODAY";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * One row per allocation of the category, valued at the valuation price
     */
    public List<BreakdownRow> investmentTable(ReferencePointSet points, ContributionCategory category, ValuationPrice valuation) {
        List<BreakdownRow> rows = new ArrayList<>();
        BigDecimal totalShares = BigDecimal.ZERO;
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal totalValue = BigDecimal.ZERO;

        for (ReferencePoint point : points.purchases()) {
            if (point.category() != category) {
                continue;
            }
            BigDecimal price = points.currentPrice(point);
            BigDecimal amount = price != null ? price.multiply(point.allocatedQuantity()) : null;
            BigDecimal value = point.outstandingQuantity().multiply(valuation.price());
            rows.add(new BreakdownRow(false, point.date(), category.name(), point.allocatedQuantity(), price, amount, value, null, null));

            totalShares = totalShares.add(point.allocatedQuantity());
            totalAmount = totalAmount.add(Objects.requireNonNullElse(amount, BigDecimal.ZERO));
            totalValue = totalValue.add(value);
        }

        rows.add(new BreakdownRow(true, null, BreakdownRow.TOTAL_LABEL, totalShares, null, totalAmount, totalValue, null, rows.size()));
        return List.copyOf(rows);
    }

    /**
     * One summary row per investment category with its share of the total investment
     */
    public List<BreakdownRow> totalInvestmentTable(ReferencePointSet points,
                                                   Map<ContributionCategory, BigDecimal> totals,
                                                   BigDecimal totalInvestment) {
        List<BreakdownRow> rows = new ArrayList<>();
        BigDecimal totalShares = BigDecimal.ZERO;
        int totalCount = 0;

        for (ContributionCategory category : ContributionCategory.values()) {
            if (!category.isClassified()) {
                continue;
            }
            List<ReferencePoint> allocations = points.purchases().stream()
                    .filter(point -> point.category() == category)
                    .toList();
            BigDecimal shares = allocations.stream()
                    .map(ReferencePoint::allocatedQuantity)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal amount = totals.getOrDefault(category, BigDecimal.ZERO);
            rows.add(new BreakdownRow(false, null, category.name(), shares, null, amount, null,
                    PortfolioMetricsCalculator.percentage(amount, totalInvestment), allocations.size()));

            totalShares = totalShares.add(shares);
            totalCount += allocations.size();
        }

        BigDecimal totalPercentage = totalInvestment.signum() > 0 ? HUNDRED : BigDecimal.ZERO;
        rows.add(new BreakdownRow(true, null, BreakdownRow.TOTAL_LABEL, totalShares, null, totalInvestment, null, totalPercentage, totalCount));
        return List.copyOf(rows);
    }

    /**
     * Value of the outstanding shares at the as-of date and at the valuation date. The total
     * row carries the change between the two, null when the portfolio has no as-of-date price.
     */
    public List<BreakdownRow> currentPortfolioTable(ReferencePointSet points,
                                                    ValuationPrice valuation,
                                                    BigDecimal outstandingShares,
                                                    BigDecimal currentValue) {
        List<BreakdownRow> rows = new ArrayList<>();
        BigDecimal asOfValue = null;

        ReferencePoint asOfPoint = points.asOfDatePoint().orElse(null);
        if (asOfPoint != null) {
            BigDecimal asOfPrice = points.currentPrice(asOfPoint);
            asOfValue = asOfPrice != null ? outstandingShares.multiply(asOfPrice) : null;
            rows.add(new BreakdownRow(false, asOfPoint.date(), VALUE_AT_AS_OF_DATE, outstandingShares, asOfPrice, null, asOfValue, null, null));
        }
        rows.add(new BreakdownRow(false, valuation.date(), VALUE_TODAY, outstandingShares, valuation.price(), null, currentValue, null, null));

        BigDecimal change = asOfValue != null ? currentValue.subtract(asOfValue) : null;
        BigDecimal changePercentage = asOfValue != null ? PortfolioMetricsCalculator.percentage(change, asOfValue) : null;
        rows.add(new BreakdownRow(true, null, BreakdownRow.TOTAL_LABEL, null, null, null, change, changePercentage, null));
        return List.copyOf(rows);
    }

    /**
     * One row per executed sale or transfer. The total row's price is the average sale price.
     */
    public List<BreakdownRow> totalSoldTable(List<SaleEvent> sales, String currency) {
        List<BreakdownRow> rows = new ArrayList<>();
        BigDecimal totalShares = BigDecimal.ZERO;
        BigDecimal totalProceeds = BigDecimal.ZERO;

        for (SaleEvent sale : sales) {
            BigDecimal proceeds = sale.proceedsIn(currency);
            rows.add(new BreakdownRow(false, sale.date(), sale.orderType().name(), sale.quantity(), sale.priceIn(currency), proceeds, null, null, null));
            totalShares = totalShares.add(sale.quantity());
            totalProceeds = totalProceeds.add(Objects.requireNonNullElse(proceeds, BigDecimal.ZERO));
        }

        BigDecimal averagePrice = totalShares.signum() > 0 ? totalProceeds.divide(totalShares, 6, RoundingMode.HALF_UP) : null;
        rows.add(new BreakdownRow(true, null, BreakdownRow.TOTAL_LABEL, totalShares, averagePrice, totalProceeds, null, null, rows.size()));
        return List.copyOf(rows);
    }

    /**
     * The cash flows fed to the XIRR solver; the total row holds the net flow
     */
    public List<BreakdownRow> cashFlowTable(List<CashFlow> cashFlows) {
        List<BreakdownRow> rows = new ArrayList<>();
        BigDecimal net = BigDecimal.ZERO;
        for (CashFlow flow : cashFlows) {
            rows.add(new BreakdownRow(false, flow.date(), flow.kind().name(), null, null, flow.amount(), null, null, null));
            net = net.add(flow.amount());
        }
        rows.add(new BreakdownRow(true, null, BreakdownRow.TOTAL_LABEL, null, null, net, null, null, rows.size()));
        return List.copyOf(rows);
    }
}
