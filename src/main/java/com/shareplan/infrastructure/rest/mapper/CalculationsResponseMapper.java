package com.shareplan.infrastructure.rest.mapper;

import com.shareplan.domain.model.BlockedShares;
import com.shareplan.domain.model.BreakdownMetric;
import com.shareplan.domain.model.BreakdownRow;
import com.shareplan.domain.model.Calculations;
import com.shareplan.domain.model.DataQualityWarning;
import com.shareplan.domain.usecase.LoadPortfolioUseCase;
import com.shareplan.infrastructure.rest.dto.BlockedSharesResponse;
import com.shareplan.infrastructure.rest.dto.BreakdownRowResponse;
import com.shareplan.infrastructure.rest.dto.CalculationsResponse;
import com.shareplan.infrastructure.rest.dto.PortfolioSessionResponse;
import com.shareplan.infrastructure.rest.dto.WarningResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * MapStruct mapper for calculation results. Amounts are normalized for the response only;
 * the engine keeps full precision.
 */
@Mapper(componentModel = "cdi")
public interface CalculationsResponseMapper {
    int MONETARY_SCALE = 4;
    int QUANTITY_SCALE = 6;
    RoundingMode ROUNDING = RoundingMode.HALF_UP;

    @Mapping(target = "currency", source = "calculations.currency")
    @Mapping(target = "availableCurrencies", source = "availableCurrencies")
    @Mapping(target = "userInvestment", expression = "java(normalizeMonetary(calculations.userInvestment()))")
    @Mapping(target = "companyMatch", expression = "java(normalizeMonetary(calculations.companyMatch()))")
    @Mapping(target = "freeShares", expression = "java(normalizeMonetary(calculations.freeShares()))")
    @Mapping(target = "companyInvestment", expression = "java(normalizeMonetary(calculations.companyInvestment()))")
    @Mapping(target = "dividendIncome", expression = "java(normalizeMonetary(calculations.dividendIncome()))")
    @Mapping(target = "totalInvestment", expression = "java(normalizeMonetary(calculations.totalInvestment()))")
    @Mapping(target = "totalSold", expression = "java(normalizeMonetary(calculations.totalSold()))")
    @Mapping(target = "currentValue", expression = "java(normalizeMonetary(calculations.currentValue()))")
    @Mapping(target = "totalValue", expression = "java(normalizeMonetary(calculations.totalValue()))")
    @Mapping(target = "totalReturn", expression = "java(normalizeMonetary(calculations.totalReturn()))")
    @Mapping(target = "returnPercentage", expression = "java(normalizeMonetary(calculations.returnPercentage()))")
    @Mapping(target = "returnOnTotalInvestment", expression = "java(normalizeMonetary(calculations.returnOnTotalInvestment()))")
    @Mapping(target = "returnPercentageOnTotalInvestment", expression = "java(normalizeMonetary(calculations.returnPercentageOnTotalInvestment()))")
    @Mapping(target = "xirrUserInvestment", expression = "java(normalizeMonetary(calculations.xirrUserInvestment()))")
    @Mapping(target = "xirrTotalInvestment", expression = "java(normalizeMonetary(calculations.xirrTotalInvestment()))")
    @Mapping(target = "availableShares", expression = "java(normalizeQuantity(calculations.availableShares()))")
    @Mapping(target = "blockedShares", expression = "java(toBlockedSharesResponse(calculations.blockedShares()))")
    @Mapping(target = "totalShares", expression = "java(normalizeQuantity(calculations.totalShares()))")
    @Mapping(target = "currentPrice", expression = "java(normalizeMonetary(calculations.currentPrice()))")
    @Mapping(target = "priceSource", expression = "java(calculations.priceSource() != null ? calculations.priceSource().name() : null)")
    @Mapping(target = "priceDate", source = "calculations.priceDate")
    @Mapping(target = "warnings", expression = "java(toWarningResponses(calculations.warnings()))")
    @Mapping(target = "breakdowns", expression = "java(toBreakdownResponses(calculations.breakdowns()))")
    @Mapping(target = "calculatedAt", source = "calculations.calculatedAt")
    CalculationsResponse toResponse(Calculations calculations, List<String> availableCurrencies);

    @Mapping(target = "shares", expression = "java(normalizeQuantity(row.shares()))")
    @Mapping(target = "price", expression = "java(normalizeMonetary(row.price()))")
    @Mapping(target = "amount", expression = "java(normalizeMonetary(row.amount()))")
    @Mapping(target = "value", expression = "java(normalizeMonetary(row.value()))")
    @Mapping(target = "percentage", expression = "java(normalizeMonetary(row.percentage()))")
    BreakdownRowResponse toBreakdownRowResponse(BreakdownRow row);

    List<BreakdownRowResponse> toBreakdownRowResponses(List<BreakdownRow> rows);

    @Mapping(target = "type", expression = "java(warning.type().name())")
    WarningResponse toWarningResponse(DataQualityWarning warning);

    List<WarningResponse> toWarningResponses(List<DataQualityWarning> warnings);

    default PortfolioSessionResponse toSessionResponse(LoadPortfolioUseCase.Result.Success success) {
        if (success == null) {
            return null;
        }
        return new PortfolioSessionResponse(
                success.sessionId(),
                success.currency(),
                success.availableCurrencies(),
                toWarningResponses(success.warnings())
        );
    }

    /**
     * Tables in metric declaration order
     */
    default Map<String, List<BreakdownRowResponse>> toBreakdownResponses(Map<BreakdownMetric, List<BreakdownRow>> breakdowns) {
        if (breakdowns == null) {
            return null;
        }
        Map<String, List<BreakdownRowResponse>> responses = new LinkedHashMap<>();
        for (BreakdownMetric metric : BreakdownMetric.values()) {
            List<BreakdownRow> rows = breakdowns.get(metric);
            if (rows != null) {
                responses.put(metric.name(), toBreakdownRowResponses(rows));
            }
        }
        return responses;
    }

    default BlockedSharesResponse toBlockedSharesResponse(BlockedShares blockedShares) {
        if (blockedShares == null) {
            return null;
        }
        Map<Integer, BigDecimal> byYear = new TreeMap<>();
        blockedShares.byYear().forEach((year, quantity) -> byYear.put(year, normalizeQuantity(quantity)));
        return new BlockedSharesResponse(normalizeQuantity(blockedShares.total()), byYear);
    }

    // Normalization helpers
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
