package com.shareplan.domain.service;

import com.shareplan.domain.model.BreakdownRow;
import com.shareplan.domain.model.CashFlow;
import com.shareplan.domain.model.CashFlowKind;
import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.PriceSource;
import com.shareplan.domain.model.ReferencePointSet;
import com.shareplan.domain.model.ValuationPrice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.shareplan.domain.service.ReferencePointFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BreakdownGeneratorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private BreakdownGenerator generator;
    private ReferencePointSet points;
    private ValuationPrice valuation;

    @BeforeEach
    void setUp() {
        generator = new BreakdownGenerator();
        points = new ReferencePointSet(List.of(
                userPurchase(LocalDate.of(2020, 1, 1), "10", "100", "60"),
                userPurchase(LocalDate.of(2021, 1, 1), "20", "50", "50"),
                purchase(ContributionCategory.COMPANY_MATCH, "Company match", ESPP, LocalDate.of(2021, 1, 1),
                        Map.of("EUR", new BigDecimal("20")), "10", "10", "0", LocalDate.of(2026, 1, 1)),
                asOfDate(LocalDate.of(2024, 3, 15), "22")), "EUR");
        valuation = new ValuationPrice(new BigDecimal("25"), PriceSource.MANUAL, TODAY);
    }

    @Test
    void testInvestmentTable_RowPerAllocationAndTotal() {
        // When
        List<BreakdownRow> rows = generator.investmentTable(points, ContributionCategory.USER_INVESTMENT, valuation);

        // Then
        assertEquals(3, rows.size());
        BreakdownRow first = rows.get(0);
        assertFalse(first.total());
        assertEquals(0, new BigDecimal("1000").compareTo(first.amount()));
        assertEquals(0, new BigDecimal("1500").compareTo(first.value()));

        BreakdownRow total = rows.get(2);
        assertTrue(total.total());
        assertEquals(BreakdownRow.TOTAL_LABEL, total.label());
        assertEquals(0, new BigDecimal("150").compareTo(total.shares()));
        assertEquals(0, new BigDecimal("2000").compareTo(total.amount()));
        assertEquals(0, new BigDecimal("2750").compareTo(total.value()));
        assertEquals(2, total.count());
    }

    @Test
    void testInvestmentTable_EmptyCategory_OnlyTotalRow() {
        // When
        List<BreakdownRow> rows = generator.investmentTable(points, ContributionCategory.DIVIDEND_INCOME, valuation);

        // Then
        assertEquals(1, rows.size());
        assertTrue(rows.get(0).total());
        assertEquals(0, BigDecimal.ZERO.compareTo(rows.get(0).amount()));
    }

    @Test
    void testTotalInvestmentTable_PercentagesOfTotal() {
        // Given
        Map<ContributionCategory, BigDecimal> totals = new EnumMap<>(ContributionCategory.class);
        totals.put(ContributionCategory.USER_INVESTMENT, new BigDecimal("2000"));
        totals.put(ContributionCategory.COMPANY_MATCH, new BigDecimal("200"));

        // When
        List<BreakdownRow> rows = generator.totalInvestmentTable(points, totals, new BigDecimal("2200"));

        // Then
        assertEquals(5, rows.size());
        assertEquals(ContributionCategory.USER_INVESTMENT.name(), rows.get(0).label());
        assertEquals(0, new BigDecimal("90.9091").compareTo(rows.get(0).percentage().setScale(4, RoundingMode.HALF_UP)));
        assertEquals(0, BigDecimal.ZERO.compareTo(rows.get(2).percentage()));
        BreakdownRow total = rows.get(4);
        assertTrue(total.total());
        assertEquals(0, new BigDecimal("100").compareTo(total.percentage()));
        assertEquals(3, total.count());
        assertEquals(1, rows.stream().filter(BreakdownRow::total).count());
    }

    @Test
    void testCurrentPortfolioTable_TotalCarriesChangeSinceAsOfDate() {
        // When
        List<BreakdownRow> rows = generator.currentPortfolioTable(points, valuation, new BigDecimal("120"), new BigDecimal("3000"));

        // Then
        assertEquals(3, rows.size());
        assertEquals(BreakdownGenerator.VALUE_AT_AS_OF_DATE, rows.get(0).label());
        assertEquals(0, new BigDecimal("2640").compareTo(rows.get(0).value()));
        assertEquals(BreakdownGenerator.VALUE_TODAY, rows.get(1).label());
        BreakdownRow total = rows.get(2);
        assertEquals(0, new BigDecimal("360").compareTo(total.value()));
        assertTrue(total.percentage().signum() > 0);
    }

    @Test
    void testCurrentPortfolioTable_WithoutAsOfDate_NoChange() {
        // Given
        ReferencePointSet withoutAsOf = new ReferencePointSet(
                List.of(userPurchase(LocalDate.of(2020, 1, 1), "10", "100", "100")), "EUR");

        // When
        List<BreakdownRow> rows = generator.currentPortfolioTable(withoutAsOf, valuation, new BigDecimal("100"), new BigDecimal("2500"));

        // Then
        assertEquals(2, rows.size());
        assertNull(rows.get(1).value());
        assertTrue(rows.get(1).total());
    }

    @Test
    void testTotalSoldTable_AveragePrice() {
        // When
        List<BreakdownRow> rows = generator.totalSoldTable(List.of(
                sale(LocalDate.of(2021, 1, 1), "40", "20"),
                sale(LocalDate.of(2022, 1, 1), "10", "30")), "EUR");

        // Then
        assertEquals(3, rows.size());
        BreakdownRow total = rows.get(2);
        assertEquals(0, new BigDecimal("50").compareTo(total.shares()));
        assertEquals(0, new BigDecimal("1100").compareTo(total.amount()));
        assertEquals(0, new BigDecimal("22").compareTo(total.price()));
    }

    @Test
    void testTotalSoldTable_NoSales() {
        // When
        List<BreakdownRow> rows = generator.totalSoldTable(List.of(), "EUR");

        // Then
        assertEquals(1, rows.size());
        assertNull(rows.get(0).price());
        assertEquals(0, rows.get(0).count());
    }

    @Test
    void testCashFlowTable_NetFlow() {
        // Given
        List<CashFlow> flows = List.of(
                new CashFlow(LocalDate.of(2021, 1, 1), new BigDecimal("-1000"), CashFlowKind.USER_INVESTMENT, "Purchase"),
                new CashFlow(TODAY, new BigDecimal("1100"), CashFlowKind.CURRENT_VALUE, "Current portfolio value"));

        // When
        List<BreakdownRow> rows = generator.cashFlowTable(flows);

        // Then
        assertEquals(3, rows.size());
        assertEquals(CashFlowKind.USER_INVESTMENT.name(), rows.get(0).label());
        assertEquals(0, new BigDecimal("100").compareTo(rows.get(2).amount()));
        assertEquals(2, rows.get(2).count());
    }
}
