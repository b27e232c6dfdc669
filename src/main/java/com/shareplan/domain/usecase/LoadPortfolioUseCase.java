package com.shareplan.domain.usecase;

import com.shareplan.domain.model.DataQualityWarning;
import com.shareplan.domain.model.PortfolioSnapshot;
import com.shareplan.domain.model.TransactionEntry;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

/**
 * Use case for loading a parsed portfolio into a calculation session
 */
public interface LoadPortfolioUseCase {

    Uni<Result> execute(Command command);

    /**
     * Discards a loaded session
     *
     * @return false when no session with that id exists
     */
    Uni<Boolean> unload(UUID sessionId);

    sealed interface Result {
        record Success(UUID sessionId, String currency, List<String> availableCurrencies, List<DataQualityWarning> warnings) implements Result {}
        record Error(com.shareplan.domain.exception.Error error, String message) implements Result {}
    }

    /**
     * @param displayCurrency currency to calculate in, the portfolio currency when null
     */
    record Command(
        PortfolioSnapshot snapshot,
        List<TransactionEntry> transactions,
        String displayCurrency
    ) {}
}
