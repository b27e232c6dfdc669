package com.shareplan.domain.service;

import com.shareplan.domain.model.CashFlow;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Annualized internal rate of return for irregularly dated cash flows.
 * Newton-Raphson first, then a closed-form approximation when it cannot converge.
 */
@Slf4j
public class XirrSolver {

    private static final double DAYS_PER_YEAR = 365.25;

    private final Settings settings;

    public XirrSolver() {
        this(Settings.defaults());
    }

    public XirrSolver(Settings settings) {
        this.settings = settings;
    }

    /**
     * @return annualized rate in percent, 0 when fewer than two flows are given or no rate can be derived
     */
    public double solve(List<CashFlow> cashFlows) {
        if (cashFlows == null || cashFlows.size() < 2) {
            return 0.0;
        }
        List<CashFlow> flows = cashFlows.stream()
                .filter(flow -> flow.date() != null && flow.amount() != null)
                .sorted(Comparator.comparing(CashFlow::date))
                .toList();
        if (flows.size() < 2) {
            return 0.0;
        }

        LocalDate start = flows.get(0).date();
        double[] amounts = flows.stream().mapToDouble(flow -> flow.amount().doubleValue()).toArray();
        double[] years = flows.stream().mapToDouble(flow -> ChronoUnit.DAYS.between(start, flow.date()) / DAYS_PER_YEAR).toArray();

        double rate = settings.initialGuess();
        for (int iteration = 0; iteration < settings.maxIterations(); iteration++) {
            double npv = 0.0;
            double derivative = 0.0;
            for (int i = 0; i < amounts.length; i++) {
                double discount = Math.pow(1 + rate, years[i]);
                npv += amounts[i] / discount;
                derivative -= years[i] * amounts[i] / (discount * (1 + rate));
            }

            if (Math.abs(npv) < settings.tolerance()) {
                log.debug("XIRR converged to {} after {} iterations", rate, iteration);
                return finite(rate * 100);
            }
            if (Math.abs(derivative) < settings.tolerance()) {
                log.debug("XIRR derivative vanished at rate {}, using approximation", rate);
                return fallback(flows);
            }

            rate = Math.max(settings.minRate(), Math.min(settings.maxRate(), rate - npv / derivative));
        }

        log.debug("XIRR did not converge after {} iterations, using approximation", settings.maxIterations());
        return fallback(flows);
    }

    /**
     * (inflow / outflow)^(1 / years) - 1 over the span of the flows
     */
    double fallback(List<CashFlow> flows) {
        double outflow = 0.0;
        double inflow = 0.0;
        for (CashFlow flow : flows) {
            double amount = flow.amount().doubleValue();
            if (amount < 0) {
                outflow -= amount;
            } else {
                inflow += amount;
            }
        }
        double years = ChronoUnit.DAYS.between(flows.get(0).date(), flows.get(flows.size() - 1).date()) / DAYS_PER_YEAR;
        if (outflow <= 0 || inflow <= 0 || years <= 0) {
            return 0.0;
        }
        return finite((Math.pow(inflow / outflow, 1 / years) - 1) * 100);
    }

    private static double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0.0 : value;
    }

    public static BigDecimal toPercent(double rate) {
        return BigDecimal.valueOf(rate).setScale(6, RoundingMode.HALF_UP);
    }

    public record Settings(double initialGuess, double tolerance, int maxIterations, double minRate, double maxRate) {

        public static Settings defaults() {
            return new Settings(0.1, 1e-6, 100, -0.99, 10.0);
        }
    }
}
