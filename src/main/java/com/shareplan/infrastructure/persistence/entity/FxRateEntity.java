package com.shareplan.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for the fx_rates table: the rate of one currency against EUR on one date
 */
@Entity
@Table(
        name = "fx_rates",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_fx_rates_date_currency", columnNames = {"rate_date", "currency"})
        }
)
@Getter
@Setter
public class FxRateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(name = "id")
    private UUID id;

    @Column(name = "rate_date", nullable = false)
    private LocalDate rateDate;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "rate", nullable = false, precision = 18, scale = 8)
    private BigDecimal rate;
}
