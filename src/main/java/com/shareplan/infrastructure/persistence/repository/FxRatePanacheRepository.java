package com.shareplan.infrastructure.persistence.repository;

import com.shareplan.infrastructure.persistence.entity.FxRateEntity;
import io.quarkus.hibernate.reactive.panache.PanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class FxRatePanacheRepository implements PanacheRepository<FxRateEntity> {

    @WithSession
    public Uni<List<FxRateEntity>> findAllOrdered() {
        return find("ORDER BY rateDate, currency").list();
    }
}
