package com.shareplan.domain.model;

import java.util.List;

/**
 * @param asOfDateMarker null when the portfolio has no as-of-date valuation
 * @param synthetic true when built from reference points because no price history exists
 */
public record PortfolioTimeline(List<TimelinePoint> points, AsOfDateMarker asOfDateMarker, boolean synthetic) {

    public PortfolioTimeline {
        points = points != null ? List.copyOf(points) : List.of();
    }

    public static PortfolioTimeline empty() {
        return new PortfolioTimeline(List.of(), null, false);
    }
}
