package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Row of a breakdown table. Labels are language-neutral codes; columns a table does not
 * use are null.
 *
 * @param amount invested amount, sale proceeds or signed cash flow depending on the table
 * @param value valuation of the row's shares at the calculation price
 * @param count number of underlying entries (summary tables only)
 */
public record BreakdownRow(
        boolean total,
        LocalDate date,
        String label,
        BigDecimal shares,
        BigDecimal price,
        BigDecimal amount,
        BigDecimal value,
        BigDecimal percentage,
        Integer count
) {

    public static final String TOTAL_LABEL = "TOTAL";
}
