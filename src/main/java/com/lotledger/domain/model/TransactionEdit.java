package com.lotledger.domain.model;

import com.lotledger.domain.enums.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Proposed modification of an existing transaction. A null field means "leave unchanged".
 */
@Data
@Builder
public class TransactionEdit {

    private LocalDate transactionDate;
    private String instrumentId;
    private TransactionType transactionType;
    private BigDecimal quantity;
    private BigDecimal unitPrice;
    private BigDecimal charges;
    private String notes;

    public boolean isEmpty() {
        return transactionDate == null
                && instrumentId == null
                && transactionType == null
                && quantity == null
                && unitPrice == null
                && charges == null
                && notes == null;
    }

    /** Returns a copy of {@code original} with every non-null field of this edit applied. */
    public LedgerTransaction applyTo(LedgerTransaction original) {
        LedgerTransaction.LedgerTransactionBuilder builder = original.toBuilder();
        if (transactionDate != null) {
            builder.transactionDate(transactionDate);
        }
        if (instrumentId != null) {
            builder.instrumentId(instrumentId);
        }
        if (transactionType != null) {
            builder.transactionType(transactionType);
        }
        if (quantity != null) {
            builder.quantity(quantity);
        }
        if (unitPrice != null) {
            builder.unitPrice(unitPrice);
        }
        if (charges != null) {
            builder.charges(charges);
        }
        if (notes != null) {
            builder.notes(notes);
        }
        return builder.build();
    }
}
