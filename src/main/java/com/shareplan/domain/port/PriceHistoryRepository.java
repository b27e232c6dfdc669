package com.shareplan.domain.port;

import com.shareplan.domain.model.PriceHistory;
import com.shareplan.domain.model.PricePoint;
import io.smallrye.mutiny.Uni;

public interface PriceHistoryRepository {

    Uni<PriceHistory> findHistory();

    /**
     * Stores a price for the given currency and date. Re-appending the same date and price is
     * a no-op; a different price on an existing date replaces it.
     *
     * @return true when a row was inserted or updated
     */
    Uni<Boolean> append(String currency, PricePoint pricePoint);
}
