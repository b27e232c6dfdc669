package com.shareplan.infrastructure.persistence.mapper;

import com.shareplan.domain.model.PricePoint;
import com.shareplan.domain.model.PriceSource;
import com.shareplan.infrastructure.persistence.entity.HistoricalPriceEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "cdi")
public interface HistoricalPriceEntityMapper {

    @Mapping(target = "date", source = "priceDate")
    @Mapping(target = "price", source = "price")
    @Mapping(target = "source", expression = "java(toSource(entity.getSource()))")
    PricePoint toDomain(HistoricalPriceEntity entity);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "currency", source = "currency")
    @Mapping(target = "priceDate", source = "pricePoint.date")
    @Mapping(target = "price", source = "pricePoint.price")
    @Mapping(target = "source", expression = "java(toSourceName(pricePoint.source()))")
    HistoricalPriceEntity toEntity(String currency, PricePoint pricePoint);

    default PriceSource toSource(String source) {
        if (source == null) {
            return PriceSource.HISTORICAL;
        }
        try {
            return PriceSource.valueOf(source);
        } catch (IllegalArgumentException e) {
            return PriceSource.HISTORICAL;
        }
    }

    default String toSourceName(PriceSource source) {
        return source != null ? source.name() : PriceSource.HISTORICAL.name();
    }
}
