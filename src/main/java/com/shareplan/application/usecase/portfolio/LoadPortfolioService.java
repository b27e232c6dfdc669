package com.shareplan.application.usecase.portfolio;

import com.shareplan.application.engine.PortfolioEngine;
import com.shareplan.application.engine.PortfolioEngineFactory;
import com.shareplan.application.engine.PortfolioSessionRegistry;
import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.exception.ServiceException;
import com.shareplan.domain.usecase.LoadPortfolioUseCase;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Service for loading portfolios into calculation sessions
 */
@ApplicationScoped
public class LoadPortfolioService implements LoadPortfolioUseCase {

    private static final Logger log = LoggerFactory.getLogger(LoadPortfolioService.class);

    private final PortfolioEngineFactory engineFactory;
    private final PortfolioSessionRegistry sessionRegistry;

    public LoadPortfolioService(PortfolioEngineFactory engineFactory, PortfolioSessionRegistry sessionRegistry) {
        this.engineFactory = engineFactory;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    public Uni<Result> execute(Command command) {
        return Uni.createFrom().deferred(() -> loadEngine(command))
                .map(engine -> {
                    UUID sessionId = sessionRegistry.register(engine);
                    return (Result) new Result.Success(sessionId, engine.currency(), engine.availableCurrencies(), engine.warnings());
                })
                .onFailure(ServiceException.class).recoverWithItem(throwable -> {
                    ServiceException serviceException = (ServiceException) throwable;
                    log.warn("Portfolio could not be loaded: {} [{}]", serviceException.getMessage(), serviceException.getErrorCode());
                    return new Result.Error(serviceException.getError(), serviceException.getMessage());
                })
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Unexpected error loading portfolio", throwable);
                    return new Result.Error(
                            Errors.Session.UNEXPECTED_ERROR,
                            "Failed to load portfolio: " + throwable.getMessage()
                    );
                });
    }

    @Override
    public Uni<Boolean> unload(UUID sessionId) {
        return Uni.createFrom().item(() -> sessionRegistry.remove(sessionId));
    }

    private Uni<PortfolioEngine> loadEngine(Command command) {
        if (command == null || command.snapshot() == null) {
            throw new ServiceException(Errors.Session.INVALID_INPUT, "A portfolio snapshot is required");
        }
        log.info("Loading portfolio: entries={}, transactions={}, currency={}, displayCurrency={}",
                command.snapshot().entries().size(),
                command.transactions() != null ? command.transactions().size() : 0,
                command.snapshot().currency(),
                command.displayCurrency());

        PortfolioEngine engine = engineFactory.create();
        return engine.load(command.snapshot(), command.transactions())
                .invoke(() -> {
                    if (command.displayCurrency() != null) {
                        engine.changeCurrency(command.displayCurrency());
                    }
                })
                .replaceWith(engine);
    }
}
