package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Historical close prices of the instrument, stored either as a flat series in one
 * currency or as a multi-currency table from which any currency's series can be extracted
 * without conversion.
 */
public final class PriceHistory {

    private static final PriceHistory EMPTY = new PriceHistory(null, List.of(), List.of());

    private final String seriesCurrency;
    private final List<PricePoint> series;
    private final List<MultiCurrencyPrice> table;

    private PriceHistory(String seriesCurrency, List<PricePoint> series, List<MultiCurrencyPrice> table) {
        this.seriesCurrency = seriesCurrency;
        this.series = series;
        this.table = table;
    }

    public static PriceHistory empty() {
        return EMPTY;
    }

    public static PriceHistory singleCurrency(String currency, List<PricePoint> series) {
        return new PriceHistory(currency, series != null ? List.copyOf(series) : List.of(), List.of());
    }

    public static PriceHistory multiCurrency(List<MultiCurrencyPrice> table) {
        return new PriceHistory(null, List.of(), table != null ? List.copyOf(table) : List.of());
    }

    public boolean isEmpty() {
        return series.isEmpty() && table.isEmpty();
    }

    public boolean isMultiCurrency() {
        return !table.isEmpty();
    }

    /**
     * Chronological series of positive prices in the given currency. A flat series only
     * answers for its own currency.
     */
    public List<PricePoint> seriesFor(String currency) {
        if (currency == null) {
            return List.of();
        }
        if (isMultiCurrency()) {
            return table.stream()
                    .filter(row -> row.date() != null && isPositive(row.priceIn(currency)))
                    .map(row -> PricePoint.historical(row.date(), row.priceIn(currency)))
                    .sorted(Comparator.comparing(PricePoint::date))
                    .toList();
        }
        if (!currency.equals(seriesCurrency)) {
            return List.of();
        }
        return series.stream()
                .filter(point -> point.date() != null && isPositive(point.price()))
                .sorted(Comparator.comparing(PricePoint::date))
                .toList();
    }

    public Set<String> currencies() {
        Set<String> currencies = new TreeSet<>();
        if (isMultiCurrency()) {
            table.forEach(row -> currencies.addAll(row.prices().keySet()));
        } else if (seriesCurrency != null && !series.isEmpty()) {
            currencies.add(seriesCurrency);
        }
        return currencies;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
