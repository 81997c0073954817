package com.lotledger.entity;

import com.lotledger.domain.enums.GainBucket;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the realized_gains table.
 * One row per (acquisition, disposal) pair produced by FIFO matching. Rows are only replaced
 * when an accepted edit re-derives the matches of an instrument.
 */
@Entity
@Table(
        name = "realized_gains",
        indexes = {
            @Index(name = "idx_gain_acquisition", columnList = "acquisition_id"),
            @Index(name = "idx_gain_disposal", columnList = "disposal_id"),
            @Index(name = "idx_gain_financial_year", columnList = "financial_year")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RealizedGainEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "acquisition_id", nullable = false)
    private Long acquisitionId;

    @Column(name = "disposal_id", nullable = false)
    private Long disposalId;

    @Column(name = "instrument_id", length = 50, nullable = false)
    private String instrumentId;

    @Column(precision = 24, scale = 8, nullable = false)
    private BigDecimal quantity;

    @Column(name = "unit_cost_basis", precision = 24, scale = 8)
    private BigDecimal unitCostBasis;

    @Column(name = "unit_proceeds", precision = 24, scale = 8)
    private BigDecimal unitProceeds;

    @Column(name = "acquisition_date")
    private LocalDate acquisitionDate;

    @Column(name = "disposal_date")
    private LocalDate disposalDate;

    @Column(name = "holding_period_days")
    private long holdingPeriodDays;

    @Enumerated(EnumType.STRING)
    @Column(length = 5)
    private GainBucket bucket;

    @Column(name = "cost_basis", precision = 24, scale = 8)
    private BigDecimal costBasis;

    @Column(precision = 24, scale = 8)
    private BigDecimal proceeds;

    @Column(name = "gain_amount", precision = 24, scale = 8)
    private BigDecimal gainAmount;

    @Column(name = "financial_year", length = 7)
    private String financialYear;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
