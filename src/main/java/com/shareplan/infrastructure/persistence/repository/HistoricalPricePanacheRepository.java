package com.shareplan.infrastructure.persistence.repository;

import com.shareplan.infrastructure.persistence.entity.HistoricalPriceEntity;
import io.quarkus.hibernate.reactive.panache.PanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.quarkus.hibernate.reactive.panache.common.WithTransaction;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;

/**
 * Panache reactive repository for HistoricalPriceEntity
 */
@ApplicationScoped
public class HistoricalPricePanacheRepository implements PanacheRepository<HistoricalPriceEntity> {

    @WithSession
    public Uni<List<HistoricalPriceEntity>> findAllOrdered() {
        return find("ORDER BY priceDate, currency").list();
    }

    @WithSession
    public Uni<HistoricalPriceEntity> findByDateAndCurrency(LocalDate priceDate, String currency) {
        return find("priceDate = ?1 and currency = ?2", priceDate, currency).firstResult();
    }

    @WithTransaction
    public Uni<HistoricalPriceEntity> save(HistoricalPriceEntity entity) {
        return persistAndFlush(entity);
    }
}
