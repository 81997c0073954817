package com.lotledger.entity;

import com.lotledger.domain.enums.TransactionType;
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
 * JPA entity for the ledger_transactions table.
 * Acquisitions (BUY) and disposals (SELL) share the table so that a type change keeps the
 * record id, and with it the audit history.
 */
@Entity
@Table(
        name = "ledger_transactions",
        indexes = @Index(name = "idx_ledger_tx_instrument_date", columnList = "instrument_id, transaction_date"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instrument_id", length = 50, nullable = false)
    private String instrumentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", length = 4, nullable = false)
    private TransactionType transactionType;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(precision = 24, scale = 8, nullable = false)
    private BigDecimal quantity;

    @Column(name = "unit_price", precision = 24, scale = 8, nullable = false)
    private BigDecimal unitPrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal charges;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
