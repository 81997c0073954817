package com.lotledger.service;

import com.lotledger.domain.enums.EditRule;
import com.lotledger.domain.enums.TransactionType;
import com.lotledger.domain.model.AuditEntry;
import com.lotledger.domain.model.EditCommitResult;
import com.lotledger.domain.model.EditImpact;
import com.lotledger.domain.model.EditProposal;
import com.lotledger.domain.model.EditViolation;
import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.domain.model.TransactionEdit;
import com.lotledger.entity.LedgerTransactionEntity;
import com.lotledger.exception.EditRejectedException;
import com.lotledger.exception.InsufficientInventoryException;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.exception.ResourceNotFoundException;
import com.lotledger.ledger.TransactionValidator;
import com.lotledger.mapper.LedgerTransactionMapper;
import com.lotledger.matching.MatchRederiver;
import com.lotledger.repository.AtomicOperationRunner;
import com.lotledger.repository.jpa.LedgerTransactionJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for modifying recorded transactions.
 *
 * <p>{@link #proposeEdit} runs the {@link EditValidator} without side effects and returns the
 * decided {@link EditProposal} with an {@link EditImpact} preview attached. {@link #commitEdit} re-validates and, inside one atomic
 * operation, applies the fields, re-derives the FIFO matches of every affected instrument from
 * the earlier of the old and new date, and writes the audit entries. If the re-derivation cannot
 * match a disposal any more, the edit is rejected and nothing is changed.
 */
@Service
public class EditService {

    private static final Logger log = LoggerFactory.getLogger(EditService.class);

    private final TransactionService transactionService;
    private final TransactionValidator transactionValidator;
    private final EditValidator editValidator;
    private final MatchRederiver matchRederiver;
    private final AuditService auditService;
    private final LedgerTransactionJpaRepository ledgerTransactionJpaRepository;
    private final LedgerTransactionMapper ledgerTransactionMapper;
    private final AtomicOperationRunner atomicOperationRunner;

    public EditService(
            TransactionService transactionService,
            TransactionValidator transactionValidator,
            EditValidator editValidator,
            MatchRederiver matchRederiver,
            AuditService auditService,
            LedgerTransactionJpaRepository ledgerTransactionJpaRepository,
            LedgerTransactionMapper ledgerTransactionMapper,
            AtomicOperationRunner atomicOperationRunner) {
        this.transactionService = transactionService;
        this.transactionValidator = transactionValidator;
        this.editValidator = editValidator;
        this.matchRederiver = matchRederiver;
        this.auditService = auditService;
        this.ledgerTransactionJpaRepository = ledgerTransactionJpaRepository;
        this.ledgerTransactionMapper = ledgerTransactionMapper;
        this.atomicOperationRunner = atomicOperationRunner;
    }

    /**
     * Validates an edit without applying it.
     *
     * @return the proposal, ACCEPTED or REJECTED (with the violation attached)
     * @throws InvalidArgumentException  for an empty edit or malformed field values
     * @throws ResourceNotFoundException if the record does not exist
     */
    public EditProposal proposeEdit(Long recordId, TransactionEdit edit) {
        if (edit == null || edit.isEmpty()) {
            throw new InvalidArgumentException("edit", "Edit must change at least one field");
        }
        LedgerTransaction original = transactionService.getTransaction(recordId);
        EditProposal proposal = new EditProposal(recordId, original, edit);
        transactionValidator.validate(proposal.getProposed());

        editValidator.validate(original, proposal.getProposed()).ifPresentOrElse(proposal::reject, proposal::accept);
        proposal.setImpact(previewImpact(original, proposal.getProposed()));
        if (proposal.isRejected()) {
            log.warn(
                    "Edit of transaction {} rejected by {}: {}",
                    recordId,
                    proposal.getViolation().getRule(),
                    proposal.getViolation().getMessage());
        }
        return proposal;
    }

    /**
     * Validates and applies an edit atomically.
     *
     * @throws EditRejectedException if a rule rejects the edit or the matches cannot be re-derived
     */
    public EditCommitResult commitEdit(Long recordId, TransactionEdit edit) {
        EditCommitResult result = atomicOperationRunner.runAtomically("commitEdit", () -> {
            EditProposal proposal = proposeEdit(recordId, edit);
            if (proposal.isRejected()) {
                throw new EditRejectedException(proposal.getViolation());
            }
            LedgerTransaction original = proposal.getOriginal();
            LedgerTransaction proposed = proposal.getProposed();
            LocalDateTime now = LocalDateTime.now();

            LedgerTransactionEntity entity = ledgerTransactionJpaRepository
                    .findById(recordId)
                    .orElseThrow(() -> new ResourceNotFoundException("Transaction", recordId));
            ledgerTransactionMapper.updateEntity(proposed, entity);
            entity.setUpdatedAt(now);
            LedgerTransaction saved = ledgerTransactionMapper.toDomain(ledgerTransactionJpaRepository.saveAndFlush(entity));

            Set<String> affected = new LinkedHashSet<>();
            List<RealizedGain> rederived = new ArrayList<>();
            if (affectsMatching(original, proposed)) {
                LocalDate fromDate = earlier(original.getTransactionDate(), proposed.getTransactionDate());
                affected.add(original.getInstrumentId());
                affected.add(proposed.getInstrumentId());
                for (String instrumentId : affected) {
                    rederived.addAll(rederive(recordId, instrumentId, fromDate));
                }
            }

            List<AuditEntry> auditEntries = auditService.logEdit(recordId, original, proposed, now);
            return EditCommitResult.builder()
                    .recordId(recordId)
                    .status(proposal.getStatus())
                    .transaction(saved)
                    .affectedInstrumentIds(affected)
                    .rederivedGains(rederived)
                    .auditEntries(auditEntries)
                    .committedAt(now)
                    .build();
        });

        log.info(
                "Committed edit of transaction {}: {} fields changed, instruments re-derived {}",
                recordId,
                result.getAuditEntries().size(),
                result.getAffectedInstrumentIds());
        return result;
    }

    private List<RealizedGain> rederive(Long recordId, String instrumentId, LocalDate fromDate) {
        try {
            return matchRederiver.rederive(instrumentId, fromDate);
        } catch (InsufficientInventoryException e) {
            log.warn("Edit of transaction {} leaves a disposal of {} unmatched: {}", recordId, instrumentId, e.getMessage());
            throw new EditRejectedException(EditViolation.builder()
                    .rule(EditRule.REDERIVATION_INSUFFICIENT_INVENTORY)
                    .field(EditRule.REDERIVATION_INSUFFICIENT_INVENTORY.getField())
                    .message("Edit would leave a later disposal of " + instrumentId + " short by "
                            + e.getShortfall().toPlainString() + " units")
                    .quantityBound(e.getShortfall())
                    .conflictingRecordIds(Collections.singletonList(recordId))
                    .build());
        }
    }

    /**
     * Net holdings of the old and new instrument before and after the edit, and the number of
     * other records of those instruments dated on or after the earlier of the two dates.
     */
    private EditImpact previewImpact(LedgerTransaction original, LedgerTransaction proposed) {
        Set<String> affected = new LinkedHashSet<>();
        affected.add(original.getInstrumentId());
        affected.add(proposed.getInstrumentId());
        LocalDate fromDate = earlier(original.getTransactionDate(), proposed.getTransactionDate());

        Map<String, BigDecimal> before = new LinkedHashMap<>();
        Map<String, BigDecimal> after = new LinkedHashMap<>();
        Map<String, BigDecimal> delta = new LinkedHashMap<>();
        long affectedTransactions = 0;
        for (String instrumentId : affected) {
            BigDecimal held = ledgerTransactionJpaRepository
                    .sumQuantity(instrumentId, TransactionType.BUY)
                    .subtract(ledgerTransactionJpaRepository.sumQuantity(instrumentId, TransactionType.SELL));
            BigDecimal change = BigDecimal.ZERO;
            if (instrumentId.equals(original.getInstrumentId())) {
                change = change.subtract(signedQuantity(original));
            }
            if (instrumentId.equals(proposed.getInstrumentId())) {
                change = change.add(signedQuantity(proposed));
            }
            before.put(instrumentId, held);
            after.put(instrumentId, held.add(change));
            delta.put(instrumentId, change);
            affectedTransactions += ledgerTransactionJpaRepository
                    .countByInstrumentIdAndTransactionDateGreaterThanEqualAndIdNot(instrumentId, fromDate, original.getId());
        }

        return EditImpact.builder()
                .affectedInstrumentIds(affected)
                .holdingsBefore(before)
                .holdingsAfter(after)
                .holdingsDelta(delta)
                .affectedTransactionCount(affectedTransactions)
                .rederivationRequired(affectsMatching(original, proposed))
                .build();
    }

    private static BigDecimal signedQuantity(LedgerTransaction transaction) {
        return transaction.getTransactionType() == TransactionType.SELL
                ? transaction.getQuantity().negate()
                : transaction.getQuantity();
    }

    /** Notes and charges do not take part in matching; every other field does. */
    private boolean affectsMatching(LedgerTransaction original, LedgerTransaction proposed) {
        return !Objects.equals(original.getTransactionDate(), proposed.getTransactionDate())
                || !Objects.equals(original.getInstrumentId(), proposed.getInstrumentId())
                || original.getTransactionType() != proposed.getTransactionType()
                || original.getQuantity().compareTo(proposed.getQuantity()) != 0
                || original.getUnitPrice().compareTo(proposed.getUnitPrice()) != 0;
    }

    private LocalDate earlier(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }
}
