package com.shareplan.domain.service;

import com.shareplan.domain.model.FxRate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FxRateTableTest {

    private FxRateTable table;

    @BeforeEach
    void setUp() {
        table = new FxRateTable(List.of(
                new FxRate(LocalDate.of(2020, 6, 1), Map.of("USD", new BigDecimal("1.20"), "GBP", new BigDecimal("0.90"))),
                new FxRate(LocalDate.of(2020, 1, 1), Map.of("USD", new BigDecimal("1.10"), "GBP", new BigDecimal("0.85"), "CHF", BigDecimal.ZERO))
        ));
    }

    @Test
    void testConvert_UsesLatestRowOnOrBeforeDate() {
        // When
        Map<String, BigDecimal> prices = table.convert(new BigDecimal("10.00"), LocalDate.of(2020, 5, 31), "EUR");

        // Then
        assertEquals(0, new BigDecimal("10.00").compareTo(prices.get("EUR")));
        assertEquals(0, new BigDecimal("11.00").compareTo(prices.get("USD")));
        assertEquals(0, new BigDecimal("8.50").compareTo(prices.get("GBP")));
    }

    @Test
    void testConvert_NeverUsesFutureRow() {
        // When
        Map<String, BigDecimal> prices = table.convert(new BigDecimal("10.00"), LocalDate.of(2019, 12, 31), "EUR");

        // Then
        assertEquals(Map.of("EUR", new BigDecimal("10.00")), prices);
    }

    @Test
    void testConvert_RowOnSameDateIsUsed() {
        // When
        Map<String, BigDecimal> prices = table.convert(new BigDecimal("10.00"), LocalDate.of(2020, 6, 1), "EUR");

        // Then
        assertEquals(0, new BigDecimal("12.00").compareTo(prices.get("USD")));
    }

    @Test
    void testConvert_NonEurOriginalGoesThroughEur() {
        // When
        Map<String, BigDecimal> prices = table.convert(new BigDecimal("11.00"), LocalDate.of(2020, 3, 1), "USD");

        // Then
        assertEquals(new BigDecimal("11.00"), prices.get("USD"));
        assertEquals(0, new BigDecimal("10").compareTo(prices.get("EUR")));
        assertEquals(0, new BigDecimal("8.5").compareTo(prices.get("GBP")));
    }

    @Test
    void testConvert_NonPositiveRatesAreSkipped() {
        // When
        Map<String, BigDecimal> prices = table.convert(new BigDecimal("10.00"), LocalDate.of(2020, 3, 1), "EUR");

        // Then
        assertFalse(prices.containsKey("CHF"));
    }

    @Test
    void testConvert_UnknownOriginalCurrency_KeepsOnlyOriginal() {
        // When
        Map<String, BigDecimal> prices = table.convert(new BigDecimal("1000"), LocalDate.of(2020, 3, 1), "SEK");

        // Then
        assertEquals(Map.of("SEK", new BigDecimal("1000")), prices);
    }

    @Test
    void testEmptyTable() {
        FxRateTable empty = new FxRateTable(null);

        assertTrue(empty.isEmpty());
        assertNull(empty.rowFor(LocalDate.of(2020, 1, 1)));
        assertEquals(Map.of("EUR", BigDecimal.TEN), empty.convert(BigDecimal.TEN, LocalDate.of(2020, 1, 1), "EUR"));
    }

    @Test
    void testIsCurrencyCode() {
        assertTrue(FxRateTable.isCurrencyCode("EUR"));
        assertFalse(FxRateTable.isCurrencyCode("eur"));
        assertFalse(FxRateTable.isCurrencyCode("EU1"));
        assertFalse(FxRateTable.isCurrencyCode("EURO"));
        assertFalse(FxRateTable.isCurrencyCode(null));
    }
}
