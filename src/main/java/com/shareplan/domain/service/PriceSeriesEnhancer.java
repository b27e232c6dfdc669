package com.shareplan.domain.service;

import com.shareplan.domain.model.AsOfDateMarker;
import com.shareplan.domain.model.DataQualityWarning;
import com.shareplan.domain.model.PricePoint;
import com.shareplan.domain.model.PriceSource;
import com.shareplan.domain.model.WarningType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Merges prices that do not come from the market data history into a price series:
 * the valuation reported by the portfolio file and a manual scenario price.
 */
@Slf4j
public class PriceSeriesEnhancer {

    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    private final BigDecimal tolerance;

    public PriceSeriesEnhancer() {
        this(DEFAULT_TOLERANCE);
    }

    public PriceSeriesEnhancer(BigDecimal tolerance) {
        this.tolerance = tolerance != null ? tolerance : DEFAULT_TOLERANCE;
    }

    /**
     * Adds the as-of-date price when the series has no close on that date. An existing close
     * is kept for valuation continuity; the reported price stays on the returned marker.
     */
    public AsOfDateMerge mergeAsOfDate(List<PricePoint> series, LocalDate asOfDate, BigDecimal asOfPrice) {
        NavigableMap<LocalDate, PricePoint> byDate = index(series);
        if (asOfDate == null || asOfPrice == null || asOfPrice.signum() <= 0) {
            return new AsOfDateMerge(List.copyOf(byDate.values()), null, null, null);
        }

        PricePoint existing = byDate.get(asOfDate);
        if (existing == null) {
            PricePoint added = new PricePoint(asOfDate, asOfPrice, PriceSource.AS_OF_DATE);
            byDate.put(asOfDate, added);
            log.info("Added as-of-date price {} on {} to the price series", asOfPrice, asOfDate);
            return new AsOfDateMerge(List.copyOf(byDate.values()), new AsOfDateMarker(asOfDate, asOfPrice, null), added, null);
        }

        DataQualityWarning warning = null;
        if (existing.price().subtract(asOfPrice).abs().compareTo(tolerance) > 0) {
            log.warn("As-of-date price {} differs from the historical close {} on {}, keeping the close",
                    asOfPrice, existing.price(), asOfDate);
            warning = new DataQualityWarning(WarningType.AS_OF_PRICE_MISMATCH, asOfDate,
                    "reported=%s, close=%s".formatted(asOfPrice.toPlainString(), existing.price().toPlainString()));
        }
        return new AsOfDateMerge(List.copyOf(byDate.values()),
                new AsOfDateMarker(asOfDate, asOfPrice, existing.price()), null, warning);
    }

    /**
     * Series with the manual price added as a scenario point: today when today has no price,
     * tomorrow when today's price differs by at least the tolerance, nowhere otherwise.
     */
    public List<PricePoint> withManualPrice(List<PricePoint> series, BigDecimal manualPrice, LocalDate today) {
        NavigableMap<LocalDate, PricePoint> byDate = index(series);
        if (manualPrice == null || manualPrice.signum() <= 0) {
            return List.copyOf(byDate.values());
        }

        PricePoint todays = byDate.get(today);
        if (todays == null) {
            byDate.put(today, new PricePoint(today, manualPrice, PriceSource.MANUAL));
        } else if (todays.price().subtract(manualPrice).abs().compareTo(tolerance) >= 0) {
            LocalDate tomorrow = today.plusDays(1);
            byDate.put(tomorrow, new PricePoint(tomorrow, manualPrice, PriceSource.MANUAL));
        }
        return List.copyOf(byDate.values());
    }

    private NavigableMap<LocalDate, PricePoint> index(List<PricePoint> series) {
        NavigableMap<LocalDate, PricePoint> byDate = new TreeMap<>();
        if (series != null) {
            series.stream()
                    .filter(point -> point.date() != null && point.price() != null)
                    .forEach(point -> byDate.put(point.date(), point));
        }
        return byDate;
    }

    /**
     * @param series merged series, sorted by date with one price per date
     * @param marker null when no as-of-date valuation was merged
     * @param addedPoint the as-of-date point that was missing from the history, to be persisted
     * @param warning mismatch between the reported price and the close, or null
     */
    public record AsOfDateMerge(List<PricePoint> series, AsOfDateMarker marker, PricePoint addedPoint, DataQualityWarning warning) {

        public boolean requiresPersistence() {
            return addedPoint != null;
        }
    }
}
