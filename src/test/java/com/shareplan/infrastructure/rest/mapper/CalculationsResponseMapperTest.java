package com.shareplan.infrastructure.rest.mapper;

import com.shareplan.domain.model.BlockedShares;
import com.shareplan.domain.model.BreakdownMetric;
import com.shareplan.domain.model.BreakdownRow;
import com.shareplan.domain.model.Calculations;
import com.shareplan.domain.model.DataQualityWarning;
import com.shareplan.domain.model.PriceSource;
import com.shareplan.domain.model.WarningType;
import com.shareplan.domain.usecase.LoadPortfolioUseCase;
import com.shareplan.infrastructure.rest.dto.BreakdownRowResponse;
import com.shareplan.infrastructure.rest.dto.CalculationsResponse;
import com.shareplan.infrastructure.rest.dto.PortfolioSessionResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CalculationsResponseMapperTest {

    private CalculationsResponseMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = Mappers.getMapper(CalculationsResponseMapper.class);
    }

    @Test
    void testToResponse_NormalizesAmounts() {
        // Given
        Calculations calculations = calculations();

        // When
        CalculationsResponse response = mapper.toResponse(calculations, List.of("EUR", "USD"));

        // Then
        assertEquals("EUR", response.currency());
        assertEquals(List.of("EUR", "USD"), response.availableCurrencies());
        assertEquals(new BigDecimal("1000.0000"), response.userInvestment());
        assertEquals(new BigDecimal("1500.1235"), response.currentValue());
        assertEquals(new BigDecimal("50.0123"), response.returnPercentage());
        assertEquals(new BigDecimal("100.000000"), response.availableShares());
        assertEquals(new BigDecimal("10.000000"), response.blockedShares().total());
        assertEquals(new BigDecimal("10.000000"), response.blockedShares().byYear().get(2026));
        assertEquals("HISTORICAL", response.priceSource());
        assertEquals(LocalDate.of(2024, 6, 28), response.priceDate());
        assertEquals(Instant.parse("2024-06-30T10:00:00Z"), response.calculatedAt());
        assertEquals(1, response.warnings().size());
        assertEquals("FX_UNAVAILABLE", response.warnings().get(0).type());
    }

    @Test
    void testToResponse_BreakdownsInMetricOrder() {
        // When
        CalculationsResponse response = mapper.toResponse(calculations(), List.of("EUR"));

        // Then
        assertEquals(List.of(BreakdownMetric.USER_INVESTMENT.name(), BreakdownMetric.TOTAL_SOLD.name()),
                new ArrayList<>(response.breakdowns().keySet()));
        List<BreakdownRowResponse> rows = response.breakdowns().get(BreakdownMetric.USER_INVESTMENT.name());
        assertEquals(2, rows.size());
        assertEquals(new BigDecimal("10.0000"), rows.get(0).price());
        assertTrue(rows.get(1).total());
        assertEquals(BreakdownRow.TOTAL_LABEL, rows.get(1).label());
        assertEquals(1, rows.get(1).count());
    }

    @Test
    void testToSessionResponse() {
        // Given
        UUID sessionId = UUID.randomUUID();
        LoadPortfolioUseCase.Result.Success success = new LoadPortfolioUseCase.Result.Success(sessionId, "EUR", List.of("EUR"),
                List.of(new DataQualityWarning(WarningType.CLASSIFICATION_GAP, LocalDate.of(2020, 1, 1), "Unknown plan")));

        // When
        PortfolioSessionResponse response = mapper.toSessionResponse(success);

        // Then
        assertEquals(sessionId, response.sessionId());
        assertEquals("EUR", response.currency());
        assertEquals("CLASSIFICATION_GAP", response.warnings().get(0).type());
        assertEquals("Unknown plan", response.warnings().get(0).detail());
    }

    @Test
    void testNormalizeMonetary_Null() {
        assertNull(mapper.normalizeMonetary(null));
        assertNull(mapper.toBlockedSharesResponse(null));
    }

    private static Calculations calculations() {
        Map<BreakdownMetric, List<BreakdownRow>> breakdowns = new EnumMap<>(BreakdownMetric.class);
        breakdowns.put(BreakdownMetric.TOTAL_SOLD, List.of(
                new BreakdownRow(true, null, BreakdownRow.TOTAL_LABEL, BigDecimal.ZERO, null, BigDecimal.ZERO, null, null, 0)));
        breakdowns.put(BreakdownMetric.USER_INVESTMENT, List.of(
                new BreakdownRow(false, LocalDate.of(2020, 1, 1), "USER_INVESTMENT", new BigDecimal("100"), new BigDecimal("10"),
                        new BigDecimal("1000"), new BigDecimal("1500.12345"), null, null),
                new BreakdownRow(true, null, BreakdownRow.TOTAL_LABEL, new BigDecimal("100"), null,
                        new BigDecimal("1000"), new BigDecimal("1500.12345"), null, 1)));

        Map<Integer, BigDecimal> byYear = new TreeMap<>();
        byYear.put(2026, BigDecimal.TEN);

        return Calculations.builder()
                .currency("EUR")
                .userInvestment(new BigDecimal("1000"))
                .currentValue(new BigDecimal("1500.12345"))
                .returnPercentage(new BigDecimal("50.012345"))
                .availableShares(new BigDecimal("100"))
                .blockedShares(new BlockedShares(BigDecimal.TEN, new TreeMap<>(byYear)))
                .totalShares(new BigDecimal("110"))
                .currentPrice(new BigDecimal("15.0012"))
                .priceSource(PriceSource.HISTORICAL)
                .priceDate(LocalDate.of(2024, 6, 28))
                .warnings(List.of(new DataQualityWarning(WarningType.FX_UNAVAILABLE, LocalDate.of(2020, 1, 1), "No USD price")))
                .breakdowns(breakdowns)
                .calculatedAt(Instant.parse("2024-06-30T10:00:00Z"))
                .build();
    }
}
