package com.shareplan.domain.service;

import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;
import com.shareplan.domain.model.BlockedShares;
import com.shareplan.domain.model.BreakdownMetric;
import com.shareplan.domain.model.BreakdownRow;
import com.shareplan.domain.model.Calculations;
import com.shareplan.domain.model.CashFlow;
import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.DataQualityWarning;
import com.shareplan.domain.model.ReferencePoint;
import com.shareplan.domain.model.ReferencePointSet;
import com.shareplan.domain.model.SaleEvent;
import com.shareplan.domain.model.ValuationPrice;
import com.shareplan.domain.model.WarningType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes investment totals, current value, returns, share availability and XIRR figures
 * of a reference point set in its active currency.
 */
@Slf4j
public class PortfolioMetricsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CashFlowBuilder cashFlowBuilder;
    private final XirrSolver xirrSolver;
    private final BreakdownGenerator breakdownGenerator;
    private final Clock clock;

    public PortfolioMetricsCalculator(CashFlowBuilder cashFlowBuilder,
                                      XirrSolver xirrSolver,
                                      BreakdownGenerator breakdownGenerator,
                                      Clock clock) {
        this.cashFlowBuilder = cashFlowBuilder;
        this.xirrSolver = xirrSolver;
        this.breakdownGenerator = breakdownGenerator;
        this.clock = clock;
    }

    /**
     * @param valuation price the outstanding shares are valued at, in the active currency
     * @throws ServiceException with {@link Errors.Calculation#MISSING_DATA} when there are no
     *                          reference points or no usable valuation price
     */
    public Calculations calculate(ReferencePointSet points, List<SaleEvent> sales, ValuationPrice valuation) {
        if (points == null || points.isEmpty()) {
            throw new ServiceException(Errors.Calculation.MISSING_DATA, "No reference points available");
        }
        if (valuation == null || valuation.price() == null || valuation.price().signum() <= 0) {
            throw new ServiceException(Errors.Calculation.MISSING_DATA,
                    "No current price available in " + points.currency());
        }
        List<SaleEvent> executedSales = sales != null ? sales : List.of();
        String currency = points.currency();
        LocalDate today = LocalDate.now(clock);
        List<DataQualityWarning> warnings = new ArrayList<>();

        Map<ContributionCategory, BigDecimal> totals = categoryTotals(points, warnings);
        BigDecimal userInvestment = totals.get(ContributionCategory.USER_INVESTMENT);
        BigDecimal companyMatch = totals.get(ContributionCategory.COMPANY_MATCH);
        BigDecimal freeShares = totals.get(ContributionCategory.FREE_SHARES);
        BigDecimal dividendIncome = totals.get(ContributionCategory.DIVIDEND_INCOME);
        BigDecimal totalInvestment = userInvestment.add(companyMatch).add(freeShares).add(dividendIncome);

        BigDecimal totalSold = totalSold(executedSales, currency, warnings);
        BigDecimal outstandingShares = BigDecimal.ZERO;
        BigDecimal availableShares = BigDecimal.ZERO;
        for (ReferencePoint point : points.purchases()) {
            outstandingShares = outstandingShares.add(point.outstandingQuantity());
            availableShares = availableShares.add(point.availableQuantity());
        }
        BigDecimal currentValue = outstandingShares.multiply(valuation.price());
        BlockedShares blockedShares = blockedShares(points);

        BigDecimal totalValue = currentValue.add(totalSold);
        BigDecimal totalReturn = totalValue.subtract(userInvestment);
        BigDecimal returnOnTotalInvestment = totalValue.subtract(totalInvestment);

        List<CashFlow> userFlows = cashFlowBuilder.userCashFlows(points, executedSales, currentValue, today);
        List<CashFlow> totalFlows = cashFlowBuilder.totalCashFlows(points, executedSales, currentValue, today);

        Map<BreakdownMetric, List<BreakdownRow>> breakdowns = new EnumMap<>(BreakdownMetric.class);
        breakdowns.put(BreakdownMetric.USER_INVESTMENT, breakdownGenerator.investmentTable(points, ContributionCategory.USER_INVESTMENT, valuation));
        breakdowns.put(BreakdownMetric.COMPANY_MATCH, breakdownGenerator.investmentTable(points, ContributionCategory.COMPANY_MATCH, valuation));
        breakdowns.put(BreakdownMetric.FREE_SHARES, breakdownGenerator.investmentTable(points, ContributionCategory.FREE_SHARES, valuation));
        breakdowns.put(BreakdownMetric.DIVIDEND_INCOME, breakdownGenerator.investmentTable(points, ContributionCategory.DIVIDEND_INCOME, valuation));
        breakdowns.put(BreakdownMetric.TOTAL_INVESTMENT, breakdownGenerator.totalInvestmentTable(points, totals, totalInvestment));
        breakdowns.put(BreakdownMetric.CURRENT_PORTFOLIO, breakdownGenerator.currentPortfolioTable(points, valuation, outstandingShares, currentValue));
        breakdowns.put(BreakdownMetric.TOTAL_SOLD, breakdownGenerator.totalSoldTable(executedSales, currency));
        breakdowns.put(BreakdownMetric.XIRR_USER_INVESTMENT, breakdownGenerator.cashFlowTable(userFlows));
        breakdowns.put(BreakdownMetric.XIRR_TOTAL_INVESTMENT, breakdownGenerator.cashFlowTable(totalFlows));

        log.debug("Calculated portfolio in {}: investment={}, currentValue={}, sold={}",
                currency, totalInvestment, currentValue, totalSold);

        return Calculations.builder()
                .userInvestment(userInvestment)
                .companyMatch(companyMatch)
                .freeShares(freeShares)
                .companyInvestment(companyMatch.add(freeShares))
                .dividendIncome(dividendIncome)
                .totalInvestment(totalInvestment)
                .totalSold(totalSold)
                .currentValue(currentValue)
                .totalValue(totalValue)
                .totalReturn(totalReturn)
                .returnPercentage(percentage(totalReturn, userInvestment))
                .returnOnTotalInvestment(returnOnTotalInvestment)
                .returnPercentageOnTotalInvestment(percentage(returnOnTotalInvestment, totalInvestment))
                .xirrUserInvestment(XirrSolver.toPercent(xirrSolver.solve(userFlows)))
                .xirrTotalInvestment(XirrSolver.toPercent(xirrSolver.solve(totalFlows)))
                .availableShares(availableShares)
                .blockedShares(blockedShares)
                .totalShares(availableShares.add(blockedShares.total()))
                .currentPrice(valuation.price())
                .priceSource(valuation.source())
                .priceDate(valuation.date())
                .currency(currency)
                .warnings(warnings)
                .breakdowns(breakdowns)
                .calculatedAt(clock.instant())
                .build();
    }

    private Map<ContributionCategory, BigDecimal> categoryTotals(ReferencePointSet points, List<DataQualityWarning> warnings) {
        Map<ContributionCategory, BigDecimal> totals = new EnumMap<>(ContributionCategory.class);
        for (ContributionCategory category : ContributionCategory.values()) {
            totals.put(category, BigDecimal.ZERO);
        }

        for (ReferencePoint point : points.purchases()) {
            if (!point.category().isClassified()) {
                continue;
            }
            BigDecimal price = points.currentPrice(point);
            if (price == null) {
                warnings.add(new DataQualityWarning(WarningType.FX_UNAVAILABLE, point.date(),
                        "No %s price for %s allocation".formatted(points.currency(), point.category())));
                continue;
            }
            totals.merge(point.category(), price.multiply(point.allocatedQuantity()), BigDecimal::add);
        }
        totals.remove(ContributionCategory.UNCLASSIFIED);
        return totals;
    }

    private BigDecimal totalSold(List<SaleEvent> sales, String currency, List<DataQualityWarning> warnings) {
        BigDecimal total = BigDecimal.ZERO;
        for (SaleEvent sale : sales) {
            BigDecimal proceeds = sale.proceedsIn(currency);
            if (proceeds == null) {
                warnings.add(new DataQualityWarning(WarningType.FX_UNAVAILABLE, sale.date(),
                        "No %s price for %s".formatted(currency, sale.orderType().getLabel())));
                continue;
            }
            total = total.add(proceeds);
        }
        return total;
    }

    private BlockedShares blockedShares(ReferencePointSet points) {
        BigDecimal total = BigDecimal.ZERO;
        Map<Integer, BigDecimal> byYear = new TreeMap<>();
        for (ReferencePoint point : points.purchases()) {
            BigDecimal blocked = point.blockedQuantity();
            if (blocked.signum() <= 0) {
                continue;
            }
            total = total.add(blocked);
            if (point.availableFrom() != null) {
                byYear.merge(point.availableFrom().getYear(), blocked, BigDecimal::add);
            }
        }
        return new BlockedShares(total, new TreeMap<>(byYear));
    }

    /**
     * numerator / denominator in percent, 0 when the denominator is not positive
     */
    static BigDecimal percentage(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(denominator, 6, RoundingMode.HALF_UP).multiply(HUNDRED);
    }
}
