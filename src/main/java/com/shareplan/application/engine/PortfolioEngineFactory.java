package com.shareplan.application.engine;

import com.shareplan.domain.port.FxRateRepository;
import com.shareplan.domain.port.PriceHistoryRepository;
import com.shareplan.domain.service.BreakdownGenerator;
import com.shareplan.domain.service.CashFlowBuilder;
import com.shareplan.domain.service.PortfolioMetricsCalculator;
import com.shareplan.domain.service.PriceSeriesEnhancer;
import com.shareplan.domain.service.ReferencePointBuilder;
import com.shareplan.domain.service.TimelineReconstructor;
import com.shareplan.domain.service.XirrSolver;
import com.shareplan.infrastructure.config.EngineConfig;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Clock;

/**
 * Creates one engine per loaded portfolio, wired with the configured collaborators
 */
@ApplicationScoped
public class PortfolioEngineFactory {

    private final FxRateRepository fxRateRepository;
    private final PriceHistoryRepository priceHistoryRepository;
    private final EngineConfig engineConfig;
    private final Clock clock;

    public PortfolioEngineFactory(FxRateRepository fxRateRepository,
                                  PriceHistoryRepository priceHistoryRepository,
                                  EngineConfig engineConfig,
                                  Clock clock) {
        this.fxRateRepository = fxRateRepository;
        this.priceHistoryRepository = priceHistoryRepository;
        this.engineConfig = engineConfig;
        this.clock = clock;
    }

    public PortfolioEngine create() {
        EngineConfig.Xirr xirr = engineConfig.xirr();
        XirrSolver xirrSolver = new XirrSolver(new XirrSolver.Settings(
                xirr.initialGuess(), xirr.tolerance(), xirr.maxIterations(), xirr.minRate(), xirr.maxRate()));

        PortfolioMetricsCalculator metricsCalculator = new PortfolioMetricsCalculator(
                new CashFlowBuilder(), xirrSolver, new BreakdownGenerator(), clock);

        return new PortfolioEngine(
                new ReferencePointBuilder(),
                new TimelineReconstructor(),
                new PriceSeriesEnhancer(engineConfig.priceTolerance()),
                metricsCalculator,
                fxRateRepository,
                priceHistoryRepository,
                clock);
    }
}
