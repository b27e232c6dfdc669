package com.shareplan.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransactionEntryTest {

    @ParameterizedTest
    @ValueSource(strings = {"Sell", "Sell at market price", "Sell with price limit", "Transfer"})
    void testExecutedSellOrTransfer_IsSale(String orderType) {
        TransactionEntry entry = new TransactionEntry(LocalDate.of(2021, 1, 1), orderType, "Executed",
                new BigDecimal("-40"), new BigDecimal("20.00"), "plan");

        assertTrue(entry.isExecutedSale());
        assertEquals(Optional.of(orderType), entry.sellOrTransferType().map(OrderType::getLabel));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Buy", "Dividend", "sell", ""})
    void testOtherOrderTypes_AreIgnored(String orderType) {
        TransactionEntry entry = new TransactionEntry(LocalDate.of(2021, 1, 1), orderType, "Executed",
                BigDecimal.TEN, BigDecimal.ONE, "plan");

        assertFalse(entry.isExecutedSale());
    }

    @Test
    void testPendingSale_IsIgnored() {
        TransactionEntry entry = new TransactionEntry(LocalDate.of(2021, 1, 1), "Sell", "Pending",
                BigDecimal.TEN, BigDecimal.ONE, "plan");

        assertFalse(entry.isExecutedSale());
    }

    @Test
    void testSaleWithoutDate_IsIgnored() {
        TransactionEntry entry = new TransactionEntry(null, "Sell", "Executed", BigDecimal.TEN, BigDecimal.ONE, "plan");

        assertFalse(entry.isExecutedSale());
    }

    @Test
    void testTransferFlag() {
        assertTrue(OrderType.TRANSFER.isTransfer());
        assertFalse(OrderType.SELL.isTransfer());
        assertTrue(OrderType.fromLabel(null).isEmpty());
    }
}
