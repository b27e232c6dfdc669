package com.shareplan.domain.port;

import com.shareplan.domain.model.FxRate;
import io.smallrye.mutiny.Uni;

import java.util.List;

public interface FxRateRepository {

    /**
     * Full EUR-quoted rate history, one row per date
     */
    Uni<List<FxRate>> findAll();
}
