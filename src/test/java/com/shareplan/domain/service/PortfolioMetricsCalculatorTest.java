package com.shareplan.domain.service;

import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;
import com.shareplan.domain.model.BreakdownMetric;
import com.shareplan.domain.model.BreakdownRow;
import com.shareplan.domain.model.Calculations;
import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.PriceSource;
import com.shareplan.domain.model.ReferencePointSet;
import com.shareplan.domain.model.ValuationPrice;
import com.shareplan.domain.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.shareplan.domain.service.ReferencePointFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PortfolioMetricsCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-06-30T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private PortfolioMetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new PortfolioMetricsCalculator(new CashFlowBuilder(), new XirrSolver(), new BreakdownGenerator(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCalculate_SinglePurchase() {
        // Given
        ReferencePointSet points = new ReferencePointSet(
                List.of(userPurchase(LocalDate.of(2020, 1, 1), "10.00", "100", "100")), "EUR");

        // When
        Calculations calculations = calculator.calculate(points, List.of(), manual("15.00"));

        // Then
        assertEquals(0, new BigDecimal("1000").compareTo(calculations.userInvestment()));
        assertEquals(0, new BigDecimal("1500").compareTo(calculations.currentValue()));
        assertEquals(0, new BigDecimal("500").compareTo(calculations.totalReturn()));
        assertEquals(0, new BigDecimal("50").compareTo(calculations.returnPercentage()));
        assertEquals(0, BigDecimal.ZERO.compareTo(calculations.totalSold()));
        assertEquals("EUR", calculations.currency());
        assertEquals(PriceSource.MANUAL, calculations.priceSource());
        assertEquals(NOW, calculations.calculatedAt());
        assertTrue(calculations.xirrUserInvestment().signum() > 0);
    }

    @Test
    void testCalculate_PartialSale() {
        // Given
        ReferencePointSet points = new ReferencePointSet(
                List.of(userPurchase(LocalDate.of(2020, 1, 1), "10.00", "100", "60")), "EUR");

        // When
        Calculations calculations = calculator.calculate(points,
                List.of(sale(LocalDate.of(2021, 1, 1), "40", "20.00")), manual("25.00"));

        // Then
        assertEquals(0, new BigDecimal("800").compareTo(calculations.totalSold()));
        assertEquals(0, new BigDecimal("1500").compareTo(calculations.currentValue()));
        assertEquals(0, new BigDecimal("2300").compareTo(calculations.totalValue()));
        assertEquals(0, new BigDecimal("1300").compareTo(calculations.totalReturn()));
        assertEquals(0, new BigDecimal("60").compareTo(calculations.totalShares()));
    }

    @Test
    void testCalculate_TotalValueEqualsCurrentValuePlusSold() {
        // Given
        ReferencePointSet points = mixedPortfolio();

        // When
        Calculations calculations = calculator.calculate(points,
                List.of(sale(LocalDate.of(2022, 1, 1), "20", "18")), manual("21.37"));

        // Then
        assertEquals(0, calculations.currentValue().add(calculations.totalSold()).compareTo(calculations.totalValue()));
        assertEquals(0, calculations.userInvestment()
                .add(calculations.companyMatch())
                .add(calculations.freeShares())
                .add(calculations.dividendIncome())
                .compareTo(calculations.totalInvestment()));
        assertEquals(0, calculations.companyMatch().add(calculations.freeShares()).compareTo(calculations.companyInvestment()));
        assertEquals(0, calculations.totalValue().subtract(calculations.totalInvestment())
                .compareTo(calculations.returnOnTotalInvestment()));
    }

    @Test
    void testCalculate_CategoryTotals() {
        // When
        Calculations calculations = calculator.calculate(mixedPortfolio(), List.of(), manual("20"));

        // Then
        assertEquals(0, new BigDecimal("1000").compareTo(calculations.userInvestment()));
        assertEquals(0, new BigDecimal("500").compareTo(calculations.companyMatch()));
        assertEquals(0, new BigDecimal("150").compareTo(calculations.freeShares()));
        assertEquals(0, new BigDecimal("24").compareTo(calculations.dividendIncome()));
        assertEquals(0, new BigDecimal("1674").compareTo(calculations.totalInvestment()));
    }

    @Test
    void testCalculate_BlockedSharesByYear() {
        // When
        Calculations calculations = calculator.calculate(mixedPortfolio(), List.of(), manual("20"));

        // Then
        assertEquals(0, new BigDecimal("60").compareTo(calculations.blockedShares().total()));
        assertEquals(0, new BigDecimal("50").compareTo(calculations.blockedShares().byYear().get(2025)));
        assertEquals(0, new BigDecimal("10").compareTo(calculations.blockedShares().byYear().get(2026)));
        assertEquals(0, calculations.availableShares().add(calculations.blockedShares().total())
                .compareTo(calculations.totalShares()));
    }

    @Test
    void testCalculate_AllBreakdownsEndWithOneTotalRow() {
        // When
        Calculations calculations = calculator.calculate(mixedPortfolio(),
                List.of(sale(LocalDate.of(2022, 1, 1), "20", "18")), manual("20"));

        // Then
        for (BreakdownMetric metric : BreakdownMetric.values()) {
            List<BreakdownRow> rows = calculations.breakdown(metric);
            assertFalse(rows.isEmpty(), metric.name());
            assertTrue(rows.get(rows.size() - 1).total(), metric.name());
            assertEquals(1, rows.stream().filter(BreakdownRow::total).count(), metric.name());
        }
        List<BreakdownRow> userFlows = calculations.breakdown(BreakdownMetric.XIRR_USER_INVESTMENT);
        // one purchase, one sale, current value, total
        assertEquals(4, userFlows.size());
    }

    @Test
    void testCalculate_MissingCurrency_WarnsAndExcludes() {
        // Given
        ReferencePointSet points = new ReferencePointSet(
                List.of(userPurchase(LocalDate.of(2020, 1, 1), "10", "100", "100")), "EUR").withCurrency("USD");

        // When
        Calculations calculations = calculator.calculate(points,
                List.of(sale(LocalDate.of(2021, 1, 1), "10", "20")), manual("12"));

        // Then
        assertEquals(0, BigDecimal.ZERO.compareTo(calculations.userInvestment()));
        assertEquals(0, BigDecimal.ZERO.compareTo(calculations.totalSold()));
        assertEquals(0, BigDecimal.ZERO.compareTo(calculations.returnPercentage()));
        assertEquals(2, calculations.warnings().stream()
                .filter(warning -> warning.type() == WarningType.FX_UNAVAILABLE)
                .count());
    }

    @Test
    void testCalculate_NoPoints_MissingData() {
        // Given
        ReferencePointSet points = new ReferencePointSet(List.of(), "EUR");

        // When
        ServiceException exception = assertThrows(ServiceException.class,
                () -> calculator.calculate(points, List.of(), manual("10")));

        // Then
        assertEquals(Errors.Calculation.MISSING_DATA, exception.getError());
    }

    @Test
    void testCalculate_NoValuationPrice_MissingData() {
        // Given
        ReferencePointSet points = new ReferencePointSet(
                List.of(userPurchase(LocalDate.of(2020, 1, 1), "10", "100", "100")), "EUR");

        // When
        ServiceException withoutPrice = assertThrows(ServiceException.class,
                () -> calculator.calculate(points, List.of(), null));
        ServiceException zeroPrice = assertThrows(ServiceException.class,
                () -> calculator.calculate(points, List.of(), manual("0")));

        // Then
        assertEquals(Errors.Calculation.MISSING_DATA, withoutPrice.getError());
        assertEquals(Errors.Calculation.MISSING_DATA, zeroPrice.getError());
    }

    @Test
    void testPercentage_ZeroDenominator() {
        assertEquals(0, BigDecimal.ZERO.compareTo(PortfolioMetricsCalculator.percentage(BigDecimal.TEN, BigDecimal.ZERO)));
        assertEquals(0, new BigDecimal("25").compareTo(PortfolioMetricsCalculator.percentage(BigDecimal.ONE, new BigDecimal("4"))));
    }

    private static ValuationPrice manual(String price) {
        return new ValuationPrice(new BigDecimal(price), PriceSource.MANUAL, TODAY);
    }

    private static ReferencePointSet mixedPortfolio() {
        return new ReferencePointSet(List.of(
                userPurchase(LocalDate.of(2020, 1, 1), "10", "100", "80"),
                purchase(ContributionCategory.COMPANY_MATCH, "Company match", ESPP, LocalDate.of(2020, 1, 1),
                        Map.of("EUR", new BigDecimal("10")), "50", "50", "0", LocalDate.of(2025, 1, 1)),
                purchase(ContributionCategory.FREE_SHARES, "Award", "Free Share", LocalDate.of(2021, 6, 1),
                        Map.of("EUR", new BigDecimal("15")), "10", "10", "0", LocalDate.of(2026, 6, 1)),
                purchase(ContributionCategory.DIVIDEND_INCOME, "Dividend", "Share Dividend Reinvestment", LocalDate.of(2022, 5, 1),
                        Map.of("EUR", new BigDecimal("12")), "2", "2", "2", null),
                asOfDate(LocalDate.of(2024, 3, 15), "19")), "EUR");
    }
}
