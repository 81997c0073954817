package com.lotledger.domain.model;

import com.lotledger.domain.enums.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A recorded acquisition (BUY) or disposal (SELL) of an instrument.
 *
 * <p>Both kinds share one record so that an accepted type change keeps the record identity
 * (and therefore its audit history). The generated {@code id} doubles as the insertion-order
 * tie-breaker when two acquisitions share a date.
 */
@Data
@Builder(toBuilder = true)
public class LedgerTransaction {

    private Long id;
    private String instrumentId;
    private TransactionType transactionType;
    private LocalDate transactionDate;
    private BigDecimal quantity;
    private BigDecimal unitPrice;

    /** Brokerage and statutory charges paid on the trade. Informational, not part of cost basis. */
    private BigDecimal charges;

    private String notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isAcquisition() {
        return transactionType == TransactionType.BUY;
    }

    public boolean isDisposal() {
        return transactionType == TransactionType.SELL;
    }
}
