package com.shareplan.application.usecase.portfolio;

import com.shareplan.application.engine.PortfolioEngine;
import com.shareplan.application.engine.PortfolioSessionRegistry;
import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;
import com.shareplan.domain.model.Calculations;
import com.shareplan.domain.usecase.CalculatePortfolioUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
@ApplicationScoped
public class CalculatePortfolioService implements CalculatePortfolioUseCase {

    private final PortfolioSessionRegistry sessionRegistry;

    public CalculatePortfolioService(PortfolioSessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    public Uni<Result> execute(Command command) {
        return Uni.createFrom().item(() -> calculate(command))
                .onFailure(ServiceException.class).recoverWithItem(throwable -> {
                    ServiceException serviceException = (ServiceException) throwable;
                    log.warn("Calculation failed for session {}: {}", command.sessionId(), serviceException.getMessage());
                    return new Result.Error(serviceException.getError(), serviceException.getMessage());
                })
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Unexpected error calculating session {}", command.sessionId(), throwable);
                    return new Result.Error(Errors.Session.UNEXPECTED_ERROR, "Failed to calculate portfolio: " + throwable.getMessage());
                });
    }

    private Result calculate(Command command) {
        Optional<PortfolioEngine> session = sessionRegistry.find(command.sessionId());
        if (session.isEmpty()) {
            return new Result.NotFound(command.sessionId());
        }
        PortfolioEngine engine = session.get();
        Calculations calculations = engine.calculate(command.currency(), command.manualPrice(), command.clearManualPrice());
        log.info("Calculated session {} in {}: currentValue={}, source={}",
                command.sessionId(), calculations.currency(), calculations.currentValue(), calculations.priceSource());
        return new Result.Success(calculations, engine.availableCurrencies());
    }
}
