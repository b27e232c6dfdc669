package com.shareplan.application.engine;

import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;
import com.shareplan.domain.model.Calculations;
import com.shareplan.domain.model.DataQualityWarning;
import com.shareplan.domain.model.PortfolioSnapshot;
import com.shareplan.domain.model.PortfolioTimeline;
import com.shareplan.domain.model.PriceHistory;
import com.shareplan.domain.model.PricePoint;
import com.shareplan.domain.model.PriceSource;
import com.shareplan.domain.model.ReferencePoint;
import com.shareplan.domain.model.ReferencePointSet;
import com.shareplan.domain.model.SaleEvent;
import com.shareplan.domain.model.TimelinePoint;
import com.shareplan.domain.model.TransactionEntry;
import com.shareplan.domain.model.ValuationPrice;
import com.shareplan.domain.port.FxRateRepository;
import com.shareplan.domain.port.PriceHistoryRepository;
import com.shareplan.domain.service.FxRateTable;
import com.shareplan.domain.service.PortfolioMetricsCalculator;
import com.shareplan.domain.service.PriceSeriesEnhancer;
import com.shareplan.domain.service.ReferencePointBuilder;
import com.shareplan.domain.service.TimelineReconstructor;
import io.smallrye.mutiny.Uni;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Calculation state of one loaded portfolio: its reference points, the active currency,
 * the loaded price history, the manual price and the last result.
 * <p>
 * Only loading talks to the ports; switching currency, changing the manual price,
 * calculating and building the timeline work on the in-memory state.
 */
@Slf4j
public class PortfolioEngine {

    private final ReferencePointBuilder referencePointBuilder;
    private final TimelineReconstructor timelineReconstructor;
    private final PriceSeriesEnhancer priceSeriesEnhancer;
    private final PortfolioMetricsCalculator metricsCalculator;
    private final FxRateRepository fxRateRepository;
    private final PriceHistoryRepository priceHistoryRepository;
    private final Clock clock;

    private PortfolioSnapshot snapshot;
    private ReferencePointSet referencePoints = new ReferencePointSet(List.of(), null);
    private List<SaleEvent> sales = List.of();
    private List<DataQualityWarning> buildWarnings = List.of();
    private PriceHistory priceHistory = PriceHistory.empty();
    private List<PricePoint> historicalSeries = List.of();
    private PriceSeriesEnhancer.AsOfDateMerge asOfDateMerge = new PriceSeriesEnhancer.AsOfDateMerge(List.of(), null, null, null);
    private BigDecimal manualPrice;
    private Calculations lastCalculations;

    public PortfolioEngine(ReferencePointBuilder referencePointBuilder,
                           TimelineReconstructor timelineReconstructor,
                           PriceSeriesEnhancer priceSeriesEnhancer,
                           PortfolioMetricsCalculator metricsCalculator,
                           FxRateRepository fxRateRepository,
                           PriceHistoryRepository priceHistoryRepository,
                           Clock clock) {
        this.referencePointBuilder = referencePointBuilder;
        this.timelineReconstructor = timelineReconstructor;
        this.priceSeriesEnhancer = priceSeriesEnhancer;
        this.metricsCalculator = metricsCalculator;
        this.fxRateRepository = fxRateRepository;
        this.priceHistoryRepository = priceHistoryRepository;
        this.clock = clock;
    }

    /**
     * Builds the reference points from the parsed files, then loads the price history and
     * stores the as-of-date price when the history does not have it yet. FX and price history
     * failures are logged and the engine continues without that data.
     */
    public Uni<Void> load(PortfolioSnapshot snapshot, List<TransactionEntry> transactions) {
        return fxRateRepository.findAll()
                .onFailure().recoverWithItem(throwable -> {
                    log.warn("FX rates could not be loaded, continuing in the portfolio currency only", throwable);
                    return List.of();
                })
                .map(rates -> referencePointBuilder.build(snapshot, transactions, rates))
                .invoke(result -> applyBuild(snapshot, result))
                .chain(this::loadPriceHistory);
    }

    /**
     * Reloads the price history, e.g. after new prices were stored
     */
    public Uni<Void> loadPriceHistory() {
        return priceHistoryRepository.findHistory()
                .onFailure().recoverWithItem(throwable -> {
                    log.warn("Price history could not be loaded [{}], timeline falls back to reference points",
                            Errors.PriceHistory.PERSISTENCE_ERROR.code(), throwable);
                    return PriceHistory.empty();
                })
                .invoke(this::applyPriceHistory)
                .chain(this::storeAsOfDatePrice);
    }

    private synchronized void applyBuild(PortfolioSnapshot snapshot, ReferencePointBuilder.Result result) {
        this.snapshot = snapshot;
        this.referencePoints = new ReferencePointSet(result.points(), snapshot.currency());
        this.sales = result.sales();
        this.buildWarnings = result.warnings();
        this.lastCalculations = null;
    }

    private synchronized void applyPriceHistory(PriceHistory history) {
        this.priceHistory = history != null ? history : PriceHistory.empty();
        refreshSeries();
        log.info("Loaded price history with {} {} prices", historicalSeries.size(), referencePoints.currency());
    }

    private Uni<Void> storeAsOfDatePrice() {
        if (snapshot == null || !snapshot.hasValuation()) {
            return Uni.createFrom().voidItem();
        }
        String currency = snapshot.currency();
        boolean known = priceHistory.seriesFor(currency).stream()
                .anyMatch(point -> point.date().equals(snapshot.asOfDate()));
        if (known) {
            return Uni.createFrom().voidItem();
        }

        PricePoint asOfDatePrice = new PricePoint(snapshot.asOfDate(), snapshot.marketPrice(), PriceSource.AS_OF_DATE);
        return priceHistoryRepository.append(currency, asOfDatePrice)
                .invoke(stored -> log.info("As-of-date price {} {} on {} stored={}",
                        asOfDatePrice.price(), currency, asOfDatePrice.date(), stored))
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Failed to store as-of-date price for {} [{}]",
                            asOfDatePrice.date(), Errors.PriceHistory.PERSISTENCE_ERROR.code(), throwable);
                    return false;
                })
                .replaceWithVoid();
    }

    private void refreshSeries() {
        String currency = referencePoints.currency();
        historicalSeries = priceHistory.seriesFor(currency);
        Optional<ReferencePoint> asOfPoint = referencePoints.asOfDatePoint();
        asOfDateMerge = priceSeriesEnhancer.mergeAsOfDate(
                historicalSeries,
                asOfPoint.map(ReferencePoint::date).orElse(null),
                asOfPoint.map(referencePoints::currentPrice).orElse(null));
    }

    /**
     * Switches the active currency. Prices were converted when the points were built, so
     * this only repoints the view and re-selects the loaded series of that currency.
     */
    public synchronized void changeCurrency(String currency) {
        if (!FxRateTable.isCurrencyCode(currency)) {
            throw new ServiceException(Errors.Currency.INVALID_INPUT, "Invalid currency code: " + currency);
        }
        if (currency.equals(referencePoints.currency())) {
            return;
        }
        log.debug("Switching active currency from {} to {}", referencePoints.currency(), currency);
        referencePoints = referencePoints.withCurrency(currency);
        refreshSeries();
        lastCalculations = null;
    }

    public synchronized void setManualPrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new ServiceException(Errors.Calculation.INVALID_INPUT, "Manual price must be positive: " + price);
        }
        manualPrice = price;
        lastCalculations = null;
    }

    public synchronized void clearManualPrice() {
        manualPrice = null;
        lastCalculations = null;
    }

    /**
     * Manual price, then the latest price of the active series with the as-of-date price
     * merged in, then the as-of-date price of the active currency
     *
     * @return null when none is available
     */
    public synchronized ValuationPrice valuationPrice() {
        LocalDate today = LocalDate.now(clock);
        if (manualPrice != null) {
            return new ValuationPrice(manualPrice, PriceSource.MANUAL, today);
        }
        List<PricePoint> series = asOfDateMerge.series();
        if (!series.isEmpty()) {
            PricePoint latest = series.get(series.size() - 1);
            return new ValuationPrice(latest.price(), latest.source(), latest.date());
        }
        return referencePoints.asOfDatePoint()
                .filter(point -> referencePoints.currentPrice(point) != null)
                .map(point -> new ValuationPrice(referencePoints.currentPrice(point), PriceSource.AS_OF_DATE, point.date()))
                .orElse(null);
    }

    /**
     * @throws ServiceException with {@link Errors.Calculation#MISSING_DATA} when nothing is loaded
     *                          or no valuation price exists in the active currency
     */
    public synchronized Calculations calculate() {
        Calculations calculations = metricsCalculator.calculate(referencePoints, sales, valuationPrice());

        List<DataQualityWarning> warnings = new ArrayList<>(buildWarnings);
        if (asOfDateMerge.warning() != null) {
            warnings.add(asOfDateMerge.warning());
        }
        warnings.addAll(calculations.warnings());

        lastCalculations = calculations.toBuilder().warnings(warnings).build();
        return lastCalculations;
    }

    /**
     * Applies a currency switch and manual price change, then calculates. When any step fails
     * the session keeps its previous currency and manual price.
     *
     * @param currency         currency to switch to, unchanged when null
     * @param manualPrice      manual price to set, unchanged when null
     * @param clearManualPrice whether to drop the manual price
     */
    public synchronized Calculations calculate(String currency, BigDecimal manualPrice, boolean clearManualPrice) {
        if (clearManualPrice && manualPrice != null) {
            throw new ServiceException(Errors.Calculation.INVALID_INPUT, "A manual price cannot be set and cleared at once");
        }

        ReferencePointSet previousPoints = referencePoints;
        List<PricePoint> previousSeries = historicalSeries;
        PriceSeriesEnhancer.AsOfDateMerge previousMerge = asOfDateMerge;
        BigDecimal previousManualPrice = this.manualPrice;
        Calculations previousCalculations = lastCalculations;
        try {
            if (currency != null) {
                changeCurrency(currency);
            }
            if (clearManualPrice) {
                clearManualPrice();
            } else if (manualPrice != null) {
                setManualPrice(manualPrice);
            }
            return calculate();
        } catch (RuntimeException e) {
            log.debug("Calculation failed, keeping {} with manual price {}", previousPoints.currency(), previousManualPrice);
            referencePoints = previousPoints;
            historicalSeries = previousSeries;
            asOfDateMerge = previousMerge;
            this.manualPrice = previousManualPrice;
            lastCalculations = previousCalculations;
            throw e;
        }
    }

    public synchronized PortfolioTimeline timeline() {
        if (referencePoints.isEmpty()) {
            return PortfolioTimeline.empty();
        }
        if (historicalSeries.isEmpty()) {
            List<TimelinePoint> points = timelineReconstructor.synthesize(referencePoints, sales);
            return new PortfolioTimeline(points, asOfDateMerge.marker(), true);
        }

        List<PricePoint> series = asOfDateMerge.series();
        if (manualPrice != null) {
            series = priceSeriesEnhancer.withManualPrice(series, manualPrice, LocalDate.now(clock));
        }
        List<TimelinePoint> points = timelineReconstructor.reconstruct(referencePoints, sales, series);
        return new PortfolioTimeline(points, asOfDateMerge.marker(), false);
    }

    public synchronized String currency() {
        return referencePoints.currency();
    }

    public synchronized List<String> availableCurrencies() {
        return referencePoints.availableCurrencies();
    }

    public synchronized ReferencePointSet referencePoints() {
        return referencePoints;
    }

    public synchronized List<SaleEvent> sales() {
        return sales;
    }

    public synchronized List<DataQualityWarning> warnings() {
        List<DataQualityWarning> warnings = new ArrayList<>(buildWarnings);
        if (asOfDateMerge.warning() != null) {
            warnings.add(asOfDateMerge.warning());
        }
        return List.copyOf(warnings);
    }

    public synchronized Optional<BigDecimal> manualPrice() {
        return Optional.ofNullable(manualPrice);
    }

    public synchronized Optional<Calculations> lastCalculations() {
        return Optional.ofNullable(lastCalculations);
    }
}
