package com.shareplan.infrastructure.rest.mapper;

import com.shareplan.domain.model.AsOfDateMarker;
import com.shareplan.domain.model.PortfolioTimeline;
import com.shareplan.domain.model.TimelinePoint;
import com.shareplan.infrastructure.rest.dto.TimelineResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimelineResponseMapperTest {

    private TimelineResponseMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = Mappers.getMapper(TimelineResponseMapper.class);
    }

    @Test
    void testToResponse_MapsPointsAndMarker() {
        // Given
        TimelinePoint point = new TimelinePoint(LocalDate.of(2020, 1, 1), new BigDecimal("10"), new BigDecimal("10"),
                new BigDecimal("100"), BigDecimal.ZERO, new BigDecimal("100"), BigDecimal.ZERO,
                "Bought 10 shares (Purchase)", true);
        PortfolioTimeline timeline = new PortfolioTimeline(List.of(point),
                new AsOfDateMarker(LocalDate.of(2024, 3, 15), new BigDecimal("25"), new BigDecimal("24.5")), false);

        // When
        TimelineResponse response = mapper.toResponse(timeline, "EUR");

        // Then
        assertEquals("EUR", response.currency());
        assertFalse(response.synthetic());
        assertEquals(1, response.points().size());
        assertEquals(new BigDecimal("10.000000"), response.points().get(0).outstandingShares());
        assertEquals(new BigDecimal("100.0000"), response.points().get(0).portfolioValue());
        assertEquals("Bought 10 shares (Purchase)", response.points().get(0).reason());
        assertTrue(response.points().get(0).hasTransaction());
        assertEquals(new BigDecimal("25.0000"), response.asOfDateMarker().reportedPrice());
        assertEquals(new BigDecimal("24.5000"), response.asOfDateMarker().historicalClose());
    }

    @Test
    void testToResponse_WithoutMarker() {
        // When
        TimelineResponse response = mapper.toResponse(new PortfolioTimeline(List.of(), null, true), "USD");

        // Then
        assertTrue(response.synthetic());
        assertTrue(response.points().isEmpty());
        assertNull(response.asOfDateMarker());
    }
}
