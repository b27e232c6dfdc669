package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDate;

@RegisterForReflection
@Schema(description = "Row of the transaction file; only executed sells and transfers are used")
public record TransactionRequest(
    @Schema(description = "Transaction date", example = "2021-01-01")
    LocalDate transactionDate,

    @Schema(description = "Order type", example = "Sell at market price")
    String orderType,

    @Schema(description = "Order status", example = "Executed")
    String status,

    @Schema(description = "Number of shares, sign is ignored", example = "40")
    BigDecimal quantity,

    @Schema(description = "Execution price per share in the portfolio currency", example = "20.00")
    BigDecimal executionPrice,

    @Schema(description = "Share plan of the order")
    String plan
) {}
