package com.lotledger.ledger;

import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.exception.InvalidArgumentException;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Field-level checks shared by every write path (new records and edited records alike).
 *
 * <p>Amounts are stored at scale {@value #MAX_SCALE}; a value carrying more significant
 * decimal places is rejected rather than rounded by the column.
 */
@Component
public class TransactionValidator {

    public static final int MAX_SCALE = 8;

    public void validate(LedgerTransaction transaction) {
        validate(
                transaction.getInstrumentId(),
                transaction.getQuantity(),
                transaction.getUnitPrice(),
                transaction.getTransactionDate(),
                transaction.getCharges());
        if (transaction.getTransactionType() == null) {
            throw new InvalidArgumentException("transactionType", "Transaction type is required");
        }
    }

    public void validate(
            String instrumentId, BigDecimal quantity, BigDecimal unitPrice, LocalDate date, BigDecimal charges) {
        if (instrumentId == null || instrumentId.isBlank()) {
            throw new InvalidArgumentException("instrumentId", "Instrument id is required");
        }
        requirePositive("quantity", quantity);
        requireStorableScale("quantity", quantity);
        requirePositive("unitPrice", unitPrice);
        requireStorableScale("unitPrice", unitPrice);
        if (date == null) {
            throw new InvalidArgumentException("transactionDate", "Transaction date is required");
        }
        if (date.isAfter(LocalDate.now())) {
            throw new InvalidArgumentException("transactionDate", "Transaction date cannot be in the future: " + date);
        }
        if (charges != null) {
            if (charges.signum() < 0) {
                throw new InvalidArgumentException("charges", "Charges cannot be negative");
            }
            requireStorableScale("charges", charges);
        }
    }

    public static void requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidArgumentException(field, field + " must be greater than zero");
        }
    }

    public static void requireStorableScale(String field, BigDecimal value) {
        if (value.stripTrailingZeros().scale() > MAX_SCALE) {
            throw new InvalidArgumentException(
                    field, field + " has more than " + MAX_SCALE + " decimal places: " + value.toPlainString());
        }
    }
}
