package com.shareplan.domain.usecase;

import com.shareplan.domain.model.Calculations;
import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Use case for calculating the metrics of a loaded portfolio, optionally switching currency
 * or manual price first
 */
public interface CalculatePortfolioUseCase {

    Uni<Result> execute(Command command);

    sealed interface Result {
        record Success(Calculations calculations, List<String> availableCurrencies) implements Result {}
        record NotFound(UUID sessionId) implements Result {}
        record Error(com.shareplan.domain.exception.Error error, String message) implements Result {}
    }

    /**
     * @param currency new active currency, unchanged when null
     * @param manualPrice scenario price in the active currency, unchanged when null
     * @param clearManualPrice drops the manual price; cannot be combined with {@code manualPrice}
     */
    record Command(
        UUID sessionId,
        String currency,
        BigDecimal manualPrice,
        boolean clearManualPrice
    ) {
        public static Command current(UUID sessionId) {
            return new Command(sessionId, null, null, false);
        }
    }
}
