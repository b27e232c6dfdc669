package com.shareplan.domain.service;

import com.shareplan.domain.model.FxRate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * EUR-quoted exchange rates indexed by date. A price is always converted with the latest
 * row dated on or before the price date, never with a later one.
 */
public class FxRateTable {

    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private static final MathContext PRECISION = MathContext.DECIMAL64;

    private final NavigableMap<LocalDate, FxRate> ratesByDate = new TreeMap<>();

    public FxRateTable(List<FxRate> rates) {
        if (rates != null) {
            rates.stream()
                    .filter(rate -> rate.date() != null)
                    .forEach(rate -> ratesByDate.put(rate.date(), rate));
        }
    }

    public boolean isEmpty() {
        return ratesByDate.isEmpty();
    }

    public FxRate rowFor(LocalDate date) {
        Map.Entry<LocalDate, FxRate> entry = ratesByDate.floorEntry(date);
        return entry != null ? entry.getValue() : null;
    }

    /**
     * Prices of {@code price} in every currency the rate row of {@code date} can convert to.
     * The original currency always keeps the exact original price; when no usable row exists
     * only the original currency is returned.
     */
    public Map<String, BigDecimal> convert(BigDecimal price, LocalDate date, String originalCurrency) {
        Map<String, BigDecimal> prices = new HashMap<>();
        prices.put(originalCurrency, price);

        FxRate row = rowFor(date);
        if (row == null) {
            return prices;
        }
        BigDecimal originalRate = row.rateFor(originalCurrency);
        if (originalRate == null) {
            return prices;
        }

        BigDecimal eurPrice = FxRate.BASE_CURRENCY.equals(originalCurrency)
                ? price
                : price.divide(originalRate, PRECISION);
        prices.put(FxRate.BASE_CURRENCY, eurPrice);

        row.rates().keySet().stream()
                .filter(FxRateTable::isCurrencyCode)
                .filter(currency -> !currency.equals(originalCurrency) && !currency.equals(FxRate.BASE_CURRENCY))
                .forEach(currency -> {
                    BigDecimal rate = row.rateFor(currency);
                    if (rate != null) {
                        prices.put(currency, eurPrice.multiply(rate, PRECISION));
                    }
                });

        prices.put(originalCurrency, price);
        return prices;
    }

    /**
     * Three upper-case letters, as in ISO 4217
     */
    public static boolean isCurrencyCode(String value) {
        return value != null && CURRENCY_CODE.matcher(value).matches();
    }
}
