package com.shareplan.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Shares not yet sellable, bucketed by the year they unlock
 */
public record BlockedShares(BigDecimal total, SortedMap<Integer, BigDecimal> byYear) {

    public BlockedShares {
        total = total != null ? total : BigDecimal.ZERO;
        byYear = Collections.unmodifiableSortedMap(byYear != null ? new TreeMap<>(byYear) : new TreeMap<>());
    }

    public static BlockedShares none() {
        return new BlockedShares(BigDecimal.ZERO, null);
    }
}
