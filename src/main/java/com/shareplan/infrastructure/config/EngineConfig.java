package com.shareplan.infrastructure.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.math.BigDecimal;
import java.time.Duration;

@ConfigMapping(prefix = "app.engine")
public interface EngineConfig {

    /**
     * Smallest difference between two prices of the same date that counts as a different price
     */
    @WithDefault("0.01")
    BigDecimal priceTolerance();

    Xirr xirr();

    Sessions sessions();

    interface Sessions {

        /**
         * A loaded portfolio not used for this long is dropped
         */
        @WithDefault("PT30M")
        Duration idleTimeout();

        @WithDefault("1000")
        long maxSize();
    }

    interface Xirr {

        @WithDefault("0.1")
        double initialGuess();

        @WithDefault("0.000001")
        double tolerance();

        @WithDefault("100")
        int maxIterations();

        @WithDefault("-0.99")
        double minRate();

        @WithDefault("10")
        double maxRate();
    }
}
