package com.lotledger.service;

import com.lotledger.domain.model.AuditEntry;
import com.lotledger.domain.model.EditSummary;
import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.entity.TransactionAuditEntity;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.mapper.TransactionAuditMapper;
import com.lotledger.repository.jpa.LedgerTransactionJpaRepository;
import com.lotledger.repository.jpa.TransactionAuditJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Field-level audit trail of accepted edits.
 *
 * <p>Every accepted edit writes one {@link AuditEntry} per tracked field whose value changed,
 * all sharing the edit's timestamp. Numeric fields are compared by value with
 * {@link BigDecimal#compareTo}, so re-scaled but equal values (10 vs 10.00000000) are not
 * reported as changes while any real difference, however small, is.
 *
 * <p>Entries are append-only. History is only deleted together with the record it belongs to.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    /** Tracked fields in the order they are written. */
    private static final Map<String, Function<LedgerTransaction, Object>> TRACKED_FIELDS = new LinkedHashMap<>();

    static {
        TRACKED_FIELDS.put("transactionDate", LedgerTransaction::getTransactionDate);
        TRACKED_FIELDS.put("instrumentId", LedgerTransaction::getInstrumentId);
        TRACKED_FIELDS.put("transactionType", LedgerTransaction::getTransactionType);
        TRACKED_FIELDS.put("quantity", LedgerTransaction::getQuantity);
        TRACKED_FIELDS.put("unitPrice", LedgerTransaction::getUnitPrice);
        TRACKED_FIELDS.put("charges", LedgerTransaction::getCharges);
        TRACKED_FIELDS.put("notes", LedgerTransaction::getNotes);
    }

    private final TransactionAuditJpaRepository transactionAuditJpaRepository;
    private final LedgerTransactionJpaRepository ledgerTransactionJpaRepository;
    private final TransactionAuditMapper transactionAuditMapper;

    public AuditService(
            TransactionAuditJpaRepository transactionAuditJpaRepository,
            LedgerTransactionJpaRepository ledgerTransactionJpaRepository,
            TransactionAuditMapper transactionAuditMapper) {
        this.transactionAuditJpaRepository = transactionAuditJpaRepository;
        this.ledgerTransactionJpaRepository = ledgerTransactionJpaRepository;
        this.transactionAuditMapper = transactionAuditMapper;
    }

    /**
     * Records the differences between {@code before} and {@code after}.
     * Writes nothing and returns an empty list when no tracked field changed.
     */
    public List<AuditEntry> logEdit(
            Long recordId, LedgerTransaction before, LedgerTransaction after, LocalDateTime timestamp) {
        List<TransactionAuditEntity> entities = new ArrayList<>();
        for (Map.Entry<String, Function<LedgerTransaction, Object>> field : TRACKED_FIELDS.entrySet()) {
            Object oldValue = field.getValue().apply(before);
            Object newValue = field.getValue().apply(after);
            if (!isSame(oldValue, newValue)) {
                entities.add(TransactionAuditEntity.builder()
                        .recordId(recordId)
                        .timestamp(timestamp)
                        .fieldName(field.getKey())
                        .oldValue(format(oldValue))
                        .newValue(format(newValue))
                        .build());
            }
        }
        if (entities.isEmpty()) {
            return Collections.emptyList();
        }

        List<AuditEntry> entries = transactionAuditMapper.toDomainList(transactionAuditJpaRepository.saveAll(entities));
        log.info("Audited {} field changes on transaction {}", entries.size(), recordId);
        return entries;
    }

    /** All entries of the record, oldest first. */
    public List<AuditEntry> getHistory(Long recordId) {
        return transactionAuditMapper.toDomainList(
                transactionAuditJpaRepository.findByRecordIdOrderByTimestampAscIdAsc(recordId));
    }

    public EditSummary getEditSummary(Long recordId) {
        List<AuditEntry> history = getHistory(recordId);

        LinkedHashSet<LocalDateTime> edits = new LinkedHashSet<>();
        LinkedHashSet<String> fields = new LinkedHashSet<>();
        for (AuditEntry entry : history) {
            edits.add(entry.getTimestamp());
            fields.add(entry.getFieldName());
        }

        return EditSummary.builder()
                .recordId(recordId)
                .edited(!history.isEmpty())
                .editCount(edits.size())
                .lastModified(history.isEmpty() ? null : history.get(history.size() - 1).getTimestamp())
                .fieldsChanged(new ArrayList<>(fields))
                .totalChanges(history.size())
                .build();
    }

    /**
     * Deletes the history of a record that no longer exists.
     *
     * @throws InvalidArgumentException while the record still exists
     */
    public int deleteHistory(Long recordId) {
        if (ledgerTransactionJpaRepository.existsById(recordId)) {
            throw new InvalidArgumentException(
                    "recordId", "Audit history of existing transaction " + recordId + " cannot be deleted");
        }
        int deleted = transactionAuditJpaRepository.deleteByRecordId(recordId);
        log.info("Deleted {} audit entries of removed transaction {}", deleted, recordId);
        return deleted;
    }

    static boolean isSame(Object oldValue, Object newValue) {
        if (oldValue instanceof BigDecimal && newValue instanceof BigDecimal) {
            return ((BigDecimal) oldValue).compareTo((BigDecimal) newValue) == 0;
        }
        return Objects.equals(oldValue, newValue);
    }

    static String format(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
