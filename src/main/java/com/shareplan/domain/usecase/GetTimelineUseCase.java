package com.shareplan.domain.usecase;

import com.shareplan.domain.model.PortfolioTimeline;
import io.smallrye.mutiny.Uni;

import java.util.UUID;

/**
 * Use case for the value timeline of a loaded portfolio in its active currency
 */
public interface GetTimelineUseCase {

    Uni<Result> execute(UUID sessionId);

    sealed interface Result {
        record Success(PortfolioTimeline timeline, String currency) implements Result {}
        record NotFound(UUID sessionId) implements Result {}
        record Error(com.shareplan.domain.exception.Error error, String message) implements Result {}
    }
}
