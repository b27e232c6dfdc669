package com.shareplan.domain.service;

import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;
import com.shareplan.domain.model.ContributionCategory;
import com.shareplan.domain.model.DataQualityWarning;
import com.shareplan.domain.model.FxRate;
import com.shareplan.domain.model.OrderType;
import com.shareplan.domain.model.PortfolioEntry;
import com.shareplan.domain.model.PortfolioSnapshot;
import com.shareplan.domain.model.ReferencePoint;
import com.shareplan.domain.model.SaleEvent;
import com.shareplan.domain.model.TransactionEntry;
import com.shareplan.domain.model.WarningType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns parsed portfolio and transaction rows into reference points and sale events.
 * Sales are matched against lots first-in first-out to derive each lot's outstanding quantity.
 */
@Slf4j
public class ReferencePointBuilder {

    public Result build(PortfolioSnapshot snapshot, List<TransactionEntry> transactions, List<FxRate> fxRates) {
        if (snapshot == null) {
            throw new ServiceException(Errors.ReferencePoints.INVALID_INPUT, "Portfolio snapshot is required");
        }
        String currency = snapshot.currency();
        if (!FxRateTable.isCurrencyCode(currency)) {
            throw new ServiceException(Errors.ReferencePoints.INVALID_INPUT, "Portfolio currency is missing or invalid: " + currency);
        }

        FxRateTable fxTable = new FxRateTable(fxRates);
        if (fxTable.isEmpty()) {
            log.warn("No FX history available, reference points will only be priced in {}", currency);
        }

        List<PortfolioEntry> lots = snapshot.entries().stream()
                .filter(PortfolioEntry::isAllocation)
                .sorted(Comparator.comparing(PortfolioEntry::allocationDate))
                .toList();
        List<SaleEvent> sales = buildSales(transactions, fxTable, currency);
        LotQuantities quantities = applySales(lots, sales);

        List<DataQualityWarning> warnings = new ArrayList<>();
        List<ReferencePoint> points = new ArrayList<>();
        for (int i = 0; i < lots.size(); i++) {
            PortfolioEntry lot = lots.get(i).withAllocatedQuantity(quantities.allocated()[i]);
            points.add(buildPurchasePoint(lot, quantities.outstanding()[i], fxTable, currency, warnings));
        }

        if (snapshot.hasValuation()) {
            points.add(ReferencePoint.asOfDate(
                    snapshot.asOfDate(),
                    fxTable.convert(snapshot.marketPrice(), snapshot.asOfDate(), currency),
                    currency));
        }

        points.sort(Comparator.comparing(ReferencePoint::date).thenComparing(ReferencePoint::type));

        log.info("Built {} reference points and {} sale events in {} ({} warnings)",
                points.size(), sales.size(), currency, warnings.size());
        return new Result(points, sales, warnings);
    }

    private ReferencePoint buildPurchasePoint(PortfolioEntry lot,
                                              BigDecimal outstanding,
                                              FxRateTable fxTable,
                                              String currency,
                                              List<DataQualityWarning> warnings) {
        ContributionCategory category = ContributionCategory.classify(lot.contributionType(), lot.plan());
        if (!category.isClassified()) {
            log.warn("No investment category for contribution type '{}' on plan '{}' ({})",
                    lot.contributionType(), lot.plan(), lot.allocationDate());
            warnings.add(new DataQualityWarning(WarningType.CLASSIFICATION_GAP, lot.allocationDate(),
                    "contributionType=%s, plan=%s".formatted(lot.contributionType(), lot.plan())));
        }

        BigDecimal reported = lot.outstandingQuantity();
        if (reported != null && reported.compareTo(outstanding) != 0) {
            log.warn("Reported outstanding quantity {} differs from {} derived from sales for lot of {}",
                    reported, outstanding, lot.allocationDate());
            warnings.add(new DataQualityWarning(WarningType.OUTSTANDING_MISMATCH, lot.allocationDate(),
                    "reported=%s, derived=%s".formatted(reported.toPlainString(), outstanding.toPlainString())));
        }

        BigDecimal available = lot.availableQuantity() != null ? lot.availableQuantity() : outstanding;
        available = available.max(BigDecimal.ZERO).min(outstanding);

        return ReferencePoint.purchase(
                lot,
                category,
                outstanding,
                available,
                fxTable.convert(lot.costBasis(), lot.allocationDate(), currency),
                currency);
    }

    private List<SaleEvent> buildSales(List<TransactionEntry> transactions, FxRateTable fxTable, String currency) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream()
                .filter(TransactionEntry::isExecutedSale)
                .sorted(Comparator.comparing(TransactionEntry::transactionDate))
                .map(transaction -> {
                    BigDecimal price = transaction.executionPrice() != null ? transaction.executionPrice() : BigDecimal.ZERO;
                    OrderType orderType = transaction.sellOrTransferType().orElseThrow();
                    return new SaleEvent(
                            transaction.transactionDate(),
                            orderType,
                            transaction.quantity(),
                            price,
                            transaction.plan(),
                            fxTable.convert(price, transaction.transactionDate(), currency));
                })
                .toList();
    }

    /**
     * Consumes each sale from the earliest lots allocated on or before the sale date.
     * <p>
     * A lot without an allocated quantity only reports what is left of it, so it takes the
     * rest of every sale that reaches it and its allocation is rebuilt as the reported
     * outstanding quantity plus what it absorbed.
     *
     * @return allocated and outstanding quantity per lot, in lot order
     * @throws ServiceException with {@link Errors.ReferencePoints#OVERSELL} when a sale exceeds the shares held at its date
     */
    LotQuantities applySales(List<PortfolioEntry> lots, List<SaleEvent> sales) {
        int size = lots.size();
        BigDecimal[] remaining = new BigDecimal[size];
        BigDecimal[] absorbed = new BigDecimal[size];
        for (int i = 0; i < size; i++) {
            remaining[i] = lots.get(i).allocatedQuantity();
            absorbed[i] = BigDecimal.ZERO;
        }

        for (SaleEvent sale : sales) {
            BigDecimal held = BigDecimal.ZERO;
            boolean openEnded = false;
            for (int i = 0; i < size && !lots.get(i).allocationDate().isAfter(sale.date()); i++) {
                if (remaining[i] == null) {
                    openEnded = true;
                    break;
                }
                held = held.add(remaining[i]);
            }
            if (!openEnded && sale.quantity().compareTo(held) > 0) {
                throw new ServiceException(Errors.ReferencePoints.OVERSELL,
                        "Sale of %s shares on %s exceeds the %s shares held at that date"
                                .formatted(sale.quantity().toPlainString(), sale.date(), held.toPlainString()));
            }

            BigDecimal toConsume = sale.quantity();
            for (int i = 0; i < size && toConsume.signum() > 0; i++) {
                if (lots.get(i).allocationDate().isAfter(sale.date())) {
                    break;
                }
                if (remaining[i] == null) {
                    absorbed[i] = absorbed[i].add(toConsume);
                    toConsume = BigDecimal.ZERO;
                    break;
                }
                BigDecimal consumed = remaining[i].min(toConsume);
                remaining[i] = remaining[i].subtract(consumed);
                toConsume = toConsume.subtract(consumed);
            }
        }

        BigDecimal[] allocated = new BigDecimal[size];
        BigDecimal[] outstanding = new BigDecimal[size];
        for (int i = 0; i < size; i++) {
            PortfolioEntry lot = lots.get(i);
            if (remaining[i] != null) {
                allocated[i] = lot.allocatedQuantity();
                outstanding[i] = remaining[i];
            } else {
                BigDecimal reported = lot.outstandingQuantity() != null ? lot.outstandingQuantity() : BigDecimal.ZERO;
                outstanding[i] = reported;
                allocated[i] = reported.add(absorbed[i]);
                if (absorbed[i].signum() > 0) {
                    log.debug("Rebuilt allocation of lot {} as {} ({} outstanding, {} sold)",
                            lot.allocationDate(), allocated[i], reported, absorbed[i]);
                }
            }
        }
        return new LotQuantities(allocated, outstanding);
    }

    record LotQuantities(BigDecimal[] allocated, BigDecimal[] outstanding) {
    }

    /**
     * Reference points sorted by date, executed sales sorted by date, and the data-quality
     * issues found while building them
     */
    public record Result(List<ReferencePoint> points, List<SaleEvent> sales, List<DataQualityWarning> warnings) {

        public Result {
            points = List.copyOf(points);
            sales = List.copyOf(sales);
            warnings = List.copyOf(warnings);
        }
    }
}
