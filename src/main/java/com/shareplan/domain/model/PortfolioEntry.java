package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One allocation row of the portfolio file, as delivered by the file parser
 *
 * @param allocatedQuantity shares originally allocated; when null it is rebuilt from the outstanding quantity and the sales
 * @param outstandingQuantity outstanding quantity as reported by the file
 */
public record PortfolioEntry(
        String plan,
        String contributionType,
        LocalDate allocationDate,
        BigDecimal costBasis,
        BigDecimal allocatedQuantity,
        BigDecimal outstandingQuantity,
        BigDecimal availableQuantity,
        LocalDate availableFrom
) {

    public BigDecimal effectiveAllocatedQuantity() {
        if (allocatedQuantity != null) {
            return allocatedQuantity;
        }
        return outstandingQuantity != null ? outstandingQuantity : BigDecimal.ZERO;
    }

    public PortfolioEntry withAllocatedQuantity(BigDecimal quantity) {
        return new PortfolioEntry(plan, contributionType, allocationDate, costBasis,
                quantity, outstandingQuantity, availableQuantity, availableFrom);
    }

    public boolean isAllocation() {
        return allocationDate != null && costBasis != null && costBasis.signum() > 0;
    }
}
