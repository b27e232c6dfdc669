package com.shareplan.infrastructure.rest.mapper;

import com.shareplan.domain.model.AsOfDateMarker;
import com.shareplan.domain.model.PortfolioTimeline;
import com.shareplan.domain.model.TimelinePoint;
import com.shareplan.infrastructure.rest.dto.AsOfDateMarkerResponse;
import com.shareplan.infrastructure.rest.dto.TimelinePointResponse;
import com.shareplan.infrastructure.rest.dto.TimelineResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Mapper(componentModel = "cdi")
public interface TimelineResponseMapper {
    int MONETARY_SCALE = 4;
    int QUANTITY_SCALE = 6;
    RoundingMode ROUNDING = RoundingMode.HALF_UP;

    @Mapping(target = "outstandingShares", expression = "java(normalizeQuantity(point.outstandingShares()))")
    @Mapping(target = "currentPrice", expression = "java(normalizeMonetary(point.currentPrice()))")
    @Mapping(target = "portfolioValue", expression = "java(normalizeMonetary(point.portfolioValue()))")
    @Mapping(target = "profitLoss", expression = "java(normalizeMonetary(point.profitLoss()))")
    @Mapping(target = "cumulativeInvestment", expression = "java(normalizeMonetary(point.cumulativeInvestment()))")
    @Mapping(target = "cumulativeSaleProceeds", expression = "java(normalizeMonetary(point.cumulativeSaleProceeds()))")
    TimelinePointResponse toPointResponse(TimelinePoint point);

    List<TimelinePointResponse> toPointResponses(List<TimelinePoint> points);

    @Mapping(target = "reportedPrice", expression = "java(normalizeMonetary(marker.reportedPrice()))")
    @Mapping(target = "historicalClose", expression = "java(normalizeMonetary(marker.historicalClose()))")
    AsOfDateMarkerResponse toMarkerResponse(AsOfDateMarker marker);

    default TimelineResponse toResponse(PortfolioTimeline timeline, String currency) {
        if (timeline == null) {
            return null;
        }
        return new TimelineResponse(
                currency,
                timeline.synthetic(),
                toPointResponses(timeline.points()),
                toMarkerResponse(timeline.asOfDateMarker())
        );
    }

    @Named("normalizeMonetary")
    default BigDecimal normalizeMonetary(BigDecimal value) {
        if (value == null) return null;
        return value.setScale(MONETARY_SCALE, ROUNDING);
    }

    @Named("normalizeQuantity")
    default BigDecimal normalizeQuantity(BigDecimal value) {
        if (value == null) return null;
        return value.setScale(QUANTITY_SCALE, ROUNDING);
    }
}
