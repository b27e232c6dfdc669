package com.shareplan.application.usecase.portfolio;

import com.shareplan.application.engine.PortfolioSessionRegistry;
import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.usecase.GetTimelineUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

@Slf4j
@ApplicationScoped
public class GetTimelineService implements GetTimelineUseCase {

    private final PortfolioSessionRegistry sessionRegistry;

    public GetTimelineService(PortfolioSessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    public Uni<Result> execute(UUID sessionId) {
        return Uni.createFrom().item(() -> sessionRegistry.find(sessionId)
                        .map(engine -> (Result) new Result.Success(engine.timeline(), engine.currency()))
                        .orElseGet(() -> new Result.NotFound(sessionId)))
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Unexpected error building timeline of session {}", sessionId, throwable);
                    return new Result.Error(Errors.Session.UNEXPECTED_ERROR, "Failed to build timeline: " + throwable.getMessage());
                });
    }
}
