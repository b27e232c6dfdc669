package com.shareplan.domain.model;

import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Dated, typed record of either an allocation lot or the portfolio's as-of-date valuation.
 * Prices are pre-computed for every convertible currency when the point is built; the
 * active currency is chosen by the {@link ReferencePointSet} holding the point.
 */
public record ReferencePoint(
        LocalDate date,
        ReferencePointType type,
        String contributionType,
        String plan,
        ContributionCategory category,
        BigDecimal costBasis,
        BigDecimal allocatedQuantity,
        BigDecimal outstandingQuantity,
        BigDecimal availableQuantity,
        LocalDate availableFrom,
        Map<String, BigDecimal> pricesByCurrency,
        String originalCurrency
) {

    public ReferencePoint {
        if (date == null || type == null) {
            throw new ServiceException(Errors.ReferencePoints.INVALID_INPUT, "Reference point requires a date and a type");
        }
        allocatedQuantity = allocatedQuantity != null ? allocatedQuantity : BigDecimal.ZERO;
        outstandingQuantity = outstandingQuantity != null ? outstandingQuantity : BigDecimal.ZERO;
        availableQuantity = availableQuantity != null ? availableQuantity : BigDecimal.ZERO;
        pricesByCurrency = pricesByCurrency != null ? Map.copyOf(pricesByCurrency) : Map.of();

        if (outstandingQuantity.compareTo(allocatedQuantity) > 0) {
            throw new ServiceException(Errors.ReferencePoints.INVALID_INPUT,
                    "Outstanding quantity %s exceeds allocated quantity %s on %s".formatted(outstandingQuantity, allocatedQuantity, date));
        }
        if (availableQuantity.compareTo(outstandingQuantity) > 0) {
            throw new ServiceException(Errors.ReferencePoints.INVALID_INPUT,
                    "Available quantity %s exceeds outstanding quantity %s on %s".formatted(availableQuantity, outstandingQuantity, date));
        }
    }

    public static ReferencePoint purchase(PortfolioEntry entry,
                                          ContributionCategory category,
                                          BigDecimal outstandingQuantity,
                                          BigDecimal availableQuantity,
                                          Map<String, BigDecimal> pricesByCurrency,
                                          String originalCurrency) {
        return new ReferencePoint(
                entry.allocationDate(),
                ReferencePointType.PURCHASE,
                entry.contributionType(),
                entry.plan(),
                category,
                entry.costBasis(),
                entry.effectiveAllocatedQuantity(),
                outstandingQuantity,
                availableQuantity,
                entry.availableFrom(),
                pricesByCurrency,
                originalCurrency
        );
    }

    public static ReferencePoint asOfDate(LocalDate date, Map<String, BigDecimal> pricesByCurrency, String originalCurrency) {
        return new ReferencePoint(
                date,
                ReferencePointType.AS_OF_DATE,
                null,
                null,
                ContributionCategory.UNCLASSIFIED,
                null,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                null,
                pricesByCurrency,
                originalCurrency
        );
    }

    public boolean isPurchase() {
        return type == ReferencePointType.PURCHASE;
    }

    public boolean isAsOfDate() {
        return type == ReferencePointType.AS_OF_DATE;
    }

    /**
     * Price in the given currency, or null when the point is not convertible to it
     */
    public BigDecimal priceIn(String currency) {
        return currency != null ? pricesByCurrency.get(currency) : null;
    }

    public BigDecimal blockedQuantity() {
        BigDecimal blocked = outstandingQuantity.subtract(availableQuantity);
        return blocked.signum() > 0 ? blocked : BigDecimal.ZERO;
    }
}
