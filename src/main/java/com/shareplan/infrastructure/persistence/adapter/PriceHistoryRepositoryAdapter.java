package com.shareplan.infrastructure.persistence.adapter;

import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;
import com.shareplan.domain.model.MultiCurrencyPrice;
import com.shareplan.domain.model.PriceHistory;
import com.shareplan.domain.model.PricePoint;
import com.shareplan.domain.port.PriceHistoryRepository;
import com.shareplan.infrastructure.persistence.entity.HistoricalPriceEntity;
import com.shareplan.infrastructure.persistence.mapper.HistoricalPriceEntityMapper;
import com.shareplan.infrastructure.persistence.repository.HistoricalPricePanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.quarkus.hibernate.reactive.panache.common.WithTransaction;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@ApplicationScoped
public class PriceHistoryRepositoryAdapter implements PriceHistoryRepository {

    private final HistoricalPricePanacheRepository panacheRepository;
    private final HistoricalPriceEntityMapper historicalPriceEntityMapper;

    public PriceHistoryRepositoryAdapter(HistoricalPricePanacheRepository panacheRepository,
                                         HistoricalPriceEntityMapper historicalPriceEntityMapper) {
        this.panacheRepository = panacheRepository;
        this.historicalPriceEntityMapper = historicalPriceEntityMapper;
    }

    /**
     * All stored closes as a multi-currency table, one row per date
     */
    @Override
    @WithSession
    public Uni<PriceHistory> findHistory() {
        return panacheRepository.findAllOrdered()
                .map(this::toPriceHistory);
    }

    @Override
    @WithTransaction
    public Uni<Boolean> append(String currency, PricePoint pricePoint) {
        if (currency == null || pricePoint == null || pricePoint.date() == null || pricePoint.price() == null) {
            return Uni.createFrom().failure(new ServiceException(Errors.PriceHistory.INVALID_INPUT,
                    "Currency, date and price are required to store a price"));
        }
        return panacheRepository.findByDateAndCurrency(pricePoint.date(), currency)
                .flatMap(existing -> {
                    if (existing == null) {
                        return panacheRepository.save(historicalPriceEntityMapper.toEntity(currency, pricePoint))
                                .map(saved -> true);
                    }
                    if (existing.getPrice().compareTo(pricePoint.price()) == 0) {
                        log.debug("Price {} {} on {} already stored", pricePoint.price(), currency, pricePoint.date());
                        return Uni.createFrom().item(false);
                    }
                    log.info("Updating {} price on {} from {} to {}", currency, pricePoint.date(), existing.getPrice(), pricePoint.price());
                    existing.setPrice(pricePoint.price());
                    existing.setSource(historicalPriceEntityMapper.toSourceName(pricePoint.source()));
                    return panacheRepository.save(existing).map(saved -> true);
                })
                .onFailure(throwable -> !(throwable instanceof ServiceException))
                .transform(throwable -> new ServiceException(Errors.PriceHistory.PERSISTENCE_ERROR,
                        "Failed to store price for " + pricePoint.date(), throwable));
    }

    private PriceHistory toPriceHistory(List<HistoricalPriceEntity> entities) {
        Map<LocalDate, Map<String, BigDecimal>> table = new TreeMap<>();
        for (HistoricalPriceEntity entity : entities) {
            PricePoint point = historicalPriceEntityMapper.toDomain(entity);
            table.computeIfAbsent(point.date(), date -> new HashMap<>())
                    .put(entity.getCurrency(), point.price());
        }
        return PriceHistory.multiCurrency(table.entrySet().stream()
                .map(row -> new MultiCurrencyPrice(row.getKey(), row.getValue()))
                .toList());
    }
}
