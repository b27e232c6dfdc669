package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable table of reference points viewed through one active currency.
 * Switching currency returns a new view over the same points; no price is recomputed.
 */
public final class ReferencePointSet {

    private final List<ReferencePoint> points;
    private final String currency;

    public ReferencePointSet(List<ReferencePoint> points, String currency) {
        this.points = points != null ? List.copyOf(points) : List.of();
        this.currency = currency;
    }

    public ReferencePointSet withCurrency(String newCurrency) {
        if (newCurrency != null && newCurrency.equals(currency)) {
            return this;
        }
        return new ReferencePointSet(points, newCurrency);
    }

    public String currency() {
        return currency;
    }

    public List<ReferencePoint> points() {
        return points;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Active price of the point, or null when the point has no price in the active currency
     */
    public BigDecimal currentPrice(ReferencePoint point) {
        return point.priceIn(currency);
    }

    public List<ReferencePoint> purchases() {
        return points.stream()
                .filter(ReferencePoint::isPurchase)
                .toList();
    }

    public Optional<ReferencePoint> asOfDatePoint() {
        return points.stream()
                .filter(ReferencePoint::isAsOfDate)
                .findFirst();
    }

    /**
     * Currencies every purchase point can be priced in
     */
    public List<String> availableCurrencies() {
        List<ReferencePoint> purchases = purchases();
        if (purchases.isEmpty()) {
            return List.of();
        }
        Set<String> common = new HashSet<>(purchases.get(0).pricesByCurrency().keySet());
        purchases.forEach(point -> common.retainAll(point.pricesByCurrency().keySet()));
        return List.copyOf(new TreeSet<>(common));
    }
}
