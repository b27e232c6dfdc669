package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * One row of the transaction file, as delivered by the file parser
 */
public record TransactionEntry(
        LocalDate transactionDate,
        String orderType,
        String status,
        BigDecimal quantity,
        BigDecimal executionPrice,
        String plan
) {

    public static final String EXECUTED = "Executed";

    public Optional<OrderType> sellOrTransferType() {
        return OrderType.fromLabel(orderType);
    }

    /**
     * An executed order that removes shares from the account
     */
    public boolean isExecutedSale() {
        return EXECUTED.equals(status)
                && transactionDate != null
                && sellOrTransferType().isPresent();
    }
}
