package com.shareplan.infrastructure.persistence.adapter;

import com.shareplan.domain.model.FxRate;
import com.shareplan.domain.port.FxRateRepository;
import com.shareplan.infrastructure.persistence.entity.FxRateEntity;
import com.shareplan.infrastructure.persistence.repository.FxRatePanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@ApplicationScoped
public class FxRateRepositoryAdapter implements FxRateRepository {

    private final FxRatePanacheRepository panacheRepository;

    public FxRateRepositoryAdapter(FxRatePanacheRepository panacheRepository) {
        this.panacheRepository = panacheRepository;
    }

    @Override
    @WithSession
    public Uni<List<FxRate>> findAll() {
        return panacheRepository.findAllOrdered()
                .map(this::toRates);
    }

    private List<FxRate> toRates(List<FxRateEntity> entities) {
        Map<LocalDate, Map<String, BigDecimal>> rows = new TreeMap<>();
        for (FxRateEntity entity : entities) {
            rows.computeIfAbsent(entity.getRateDate(), date -> new HashMap<>())
                    .put(entity.getCurrency(), entity.getRate());
        }
        return rows.entrySet().stream()
                .map(row -> new FxRate(row.getKey(), row.getValue()))
                .toList();
    }
}
