package com.shareplan.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * JPA entity for the historical_prices table, one close per date and currency
 */
@Entity
@Table(
        name = "historical_prices",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_historical_prices_date_currency", columnNames = {"price_date", "currency"})
        },
        indexes = {
                @Index(name = "idx_historical_prices_date", columnList = "price_date")
        }
)
@Getter
@Setter
public class HistoricalPriceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(name = "id")
    private UUID id;

    @Column(name = "price_date", nullable = false)
    private LocalDate priceDate;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "price", nullable = false, precision = 18, scale = 6)
    private BigDecimal price;

    @Column(name = "source", nullable = false, length = 20)
    private String source;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = OffsetDateTime.now();
    }
}
