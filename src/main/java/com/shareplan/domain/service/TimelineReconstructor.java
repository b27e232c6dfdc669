package com.shareplan.domain.service;

import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.PricePoint;
import com.shareplan.domain.model.ReferencePoint;
import com.shareplan.domain.model.ReferencePointSet;
import com.shareplan.domain.model.SaleEvent;
import com.shareplan.domain.model.TimelinePoint;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Rebuilds the portfolio value over time from reference points and executed sales.
 * Points are emitted only at sampled dates, never interpolated.
 */
@Slf4j
public class TimelineReconstructor {

    /**
     * One timeline point per date of the price series, valued with the running share count
     * as of that date.
     */
    public List<TimelinePoint> reconstruct(ReferencePointSet points, List<SaleEvent> sales, List<PricePoint> historicalPrices) {
        if (historicalPrices == null || historicalPrices.isEmpty()) {
            return List.of();
        }
        NavigableMap<LocalDate, BigDecimal> samples = new TreeMap<>();
        historicalPrices.stream()
                .filter(price -> price.date() != null && price.price() != null)
                .forEach(price -> samples.put(price.date(), price.price()));
        return emit(points, sales, samples);
    }

    /**
     * Step-function timeline sampled at the reference point dates, used when no price series
     * is available. The price of a date is the as-of-date valuation when one falls on it,
     * otherwise the highest purchase price of that date; dates without any price carry the
     * previous one forward.
     */
    public List<TimelinePoint> synthesize(ReferencePointSet points, List<SaleEvent> sales) {
        NavigableMap<LocalDate, BigDecimal> samples = new TreeMap<>();
        BigDecimal previous = null;
        for (LocalDate date : referenceDates(points)) {
            BigDecimal price = priceAt(points, date);
            if (price == null) {
                price = previous;
            }
            if (price != null) {
                samples.put(date, price);
                previous = price;
            }
        }
        log.debug("Synthesized {} timeline samples from reference points", samples.size());
        return emit(points, sales, samples);
    }

    private List<TimelinePoint> emit(ReferencePointSet points, List<SaleEvent> sales, NavigableMap<LocalDate, BigDecimal> samples) {
        NavigableMap<LocalDate, DayEvents> events = collectEvents(points, sales);

        List<TimelinePoint> timeline = new ArrayList<>(samples.size());
        BigDecimal shares = BigDecimal.ZERO;
        BigDecimal invested = BigDecimal.ZERO;
        BigDecimal proceeds = BigDecimal.ZERO;
        Iterator<Map.Entry<LocalDate, DayEvents>> pending = events.entrySet().iterator();
        Map.Entry<LocalDate, DayEvents> next = pending.hasNext() ? pending.next() : null;

        for (Map.Entry<LocalDate, BigDecimal> sample : samples.entrySet()) {
            LocalDate date = sample.getKey();
            DayEvents today = null;
            while (next != null && !next.getKey().isAfter(date)) {
                shares = shares.add(next.getValue().shareDelta);
                invested = invested.add(next.getValue().investment);
                proceeds = proceeds.add(next.getValue().proceeds);
                if (next.getKey().equals(date)) {
                    today = next.getValue();
                }
                next = pending.hasNext() ? pending.next() : null;
            }

            BigDecimal price = sample.getValue();
            BigDecimal value = shares.multiply(price);
            boolean hasTransaction = today != null && today.shareDelta.signum() != 0;
            timeline.add(new TimelinePoint(
                    date,
                    shares,
                    price,
                    value,
                    value.add(proceeds).subtract(invested),
                    invested,
                    proceeds,
                    today != null ? String.join("; ", today.reasons) : "",
                    hasTransaction));
        }
        return timeline;
    }

    private NavigableMap<LocalDate, DayEvents> collectEvents(ReferencePointSet points, List<SaleEvent> sales) {
        NavigableMap<LocalDate, DayEvents> events = new TreeMap<>();
        String currency = points.currency();

        for (ReferencePoint purchase : points.purchases()) {
            DayEvents day = events.computeIfAbsent(purchase.date(), date -> new DayEvents());
            day.shareDelta = day.shareDelta.add(purchase.allocatedQuantity());
            BigDecimal price = points.currentPrice(purchase);
            if (purchase.category() == ContributionCategory.USER_INVESTMENT && price != null) {
                day.investment = day.investment.add(price.multiply(purchase.allocatedQuantity()));
            }
            day.reasons.add("Bought %s shares (%s)".formatted(
                    purchase.allocatedQuantity().stripTrailingZeros().toPlainString(), purchase.contributionType()));
        }

        if (sales != null) {
            for (SaleEvent sale : sales) {
                DayEvents day = events.computeIfAbsent(sale.date(), date -> new DayEvents());
                day.shareDelta = day.shareDelta.subtract(sale.quantity());
                BigDecimal saleProceeds = sale.proceedsIn(currency);
                if (saleProceeds != null) {
                    day.proceeds = day.proceeds.add(saleProceeds);
                }
                day.reasons.add("Sold %s shares (%s)".formatted(
                        sale.quantity().stripTrailingZeros().toPlainString(), sale.orderType().getLabel()));
            }
        }
        return events;
    }

    private List<LocalDate> referenceDates(ReferencePointSet points) {
        return points.points().stream()
                .map(ReferencePoint::date)
                .distinct()
                .sorted()
                .toList();
    }

    private BigDecimal priceAt(ReferencePointSet points, LocalDate date) {
        BigDecimal asOfPrice = points.asOfDatePoint()
                .filter(point -> point.date().equals(date))
                .map(points::currentPrice)
                .orElse(null);
        if (asOfPrice != null) {
            return asOfPrice;
        }
        return points.purchases().stream()
                .filter(point -> point.date().equals(date))
                .map(points::currentPrice)
                .filter(price -> price != null)
                .max(BigDecimal::compareTo)
                .orElse(null);
    }

    private static final class DayEvents {
        private BigDecimal shareDelta = BigDecimal.ZERO;
        private BigDecimal investment = BigDecimal.ZERO;
        private BigDecimal proceeds = BigDecimal.ZERO;
        private final List<String> reasons = new ArrayList<>();
    }
}
