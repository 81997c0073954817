package com.lotledger.service;

import com.lotledger.domain.enums.EditRule;
import com.lotledger.domain.enums.TransactionType;
import com.lotledger.domain.model.EditViolation;
import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.entity.LedgerTransactionEntity;
import com.lotledger.exception.EditRejectedException;
import com.lotledger.exception.ResourceNotFoundException;
import com.lotledger.ledger.LotLedger;
import com.lotledger.ledger.TransactionValidator;
import com.lotledger.mapper.LedgerTransactionMapper;
import com.lotledger.mapper.RealizedGainMapper;
import com.lotledger.repository.AtomicOperationRunner;
import com.lotledger.repository.jpa.LedgerTransactionJpaRepository;
import com.lotledger.repository.jpa.RealizedGainJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records acquisitions and serves reads of the ledger's transactions.
 *
 * <p>Disposals are recorded through {@link DisposalService} (they need matching) and existing
 * records change only through {@link EditService}. An acquisition can be deleted as long as
 * none of its quantity has been consumed; disposals are never deleted.
 */
@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final LedgerTransactionJpaRepository ledgerTransactionJpaRepository;
    private final RealizedGainJpaRepository realizedGainJpaRepository;
    private final LedgerTransactionMapper ledgerTransactionMapper;
    private final RealizedGainMapper realizedGainMapper;
    private final TransactionValidator transactionValidator;
    private final LotLedger lotLedger;
    private final AuditService auditService;
    private final AtomicOperationRunner atomicOperationRunner;

    public TransactionService(
            LedgerTransactionJpaRepository ledgerTransactionJpaRepository,
            RealizedGainJpaRepository realizedGainJpaRepository,
            LedgerTransactionMapper ledgerTransactionMapper,
            RealizedGainMapper realizedGainMapper,
            TransactionValidator transactionValidator,
            LotLedger lotLedger,
            AuditService auditService,
            AtomicOperationRunner atomicOperationRunner) {
        this.ledgerTransactionJpaRepository = ledgerTransactionJpaRepository;
        this.realizedGainJpaRepository = realizedGainJpaRepository;
        this.ledgerTransactionMapper = ledgerTransactionMapper;
        this.realizedGainMapper = realizedGainMapper;
        this.transactionValidator = transactionValidator;
        this.lotLedger = lotLedger;
        this.auditService = auditService;
        this.atomicOperationRunner = atomicOperationRunner;
    }

    public LedgerTransaction recordAcquisition(
            String instrumentId, BigDecimal quantity, BigDecimal unitPrice, LocalDate date) {
        return recordAcquisition(instrumentId, quantity, unitPrice, date, null, null);
    }

    public LedgerTransaction recordAcquisition(
            String instrumentId,
            BigDecimal quantity,
            BigDecimal unitPrice,
            LocalDate date,
            BigDecimal charges,
            String notes) {
        transactionValidator.validate(instrumentId, quantity, unitPrice, date, charges);

        LocalDateTime now = LocalDateTime.now();
        LedgerTransactionEntity entity = LedgerTransactionEntity.builder()
                .instrumentId(instrumentId)
                .transactionType(TransactionType.BUY)
                .transactionDate(date)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .charges(charges != null ? charges : BigDecimal.ZERO)
                .notes(notes)
                .createdAt(now)
                .updatedAt(now)
                .build();

        LedgerTransaction saved = ledgerTransactionMapper.toDomain(
                atomicOperationRunner.runAtomically("recordAcquisition", () -> ledgerTransactionJpaRepository.save(entity)));
        log.info(
                "Recorded acquisition {}: {} x {} @ {} on {}",
                saved.getId(),
                instrumentId,
                quantity.toPlainString(),
                unitPrice.toPlainString(),
                date);
        return saved;
    }

    public LedgerTransaction getTransaction(Long id) {
        return ledgerTransactionJpaRepository
                .findById(id)
                .map(ledgerTransactionMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", id));
    }

    /** Transactions of one instrument, or of the whole ledger when {@code instrumentId} is null. */
    public List<LedgerTransaction> getTransactions(String instrumentId) {
        if (instrumentId == null || instrumentId.isBlank()) {
            return ledgerTransactionMapper.toDomainList(ledgerTransactionJpaRepository.findAllByOrderByTransactionDateAscIdAsc());
        }
        return ledgerTransactionMapper.toDomainList(
                ledgerTransactionJpaRepository.findByInstrumentIdOrderByTransactionDateAscIdAsc(instrumentId));
    }

    public List<String> getInstrumentIds() {
        return ledgerTransactionJpaRepository.findDistinctInstrumentIds();
    }

    /** Realized gains of a disposal (by disposal id) or drawn from an acquisition (by acquisition id). */
    public List<RealizedGain> getRealizedGains(Long transactionId) {
        LedgerTransaction transaction = getTransaction(transactionId);
        if (transaction.isDisposal()) {
            return realizedGainMapper.toDomainList(realizedGainJpaRepository.findByDisposalIdOrderByIdAsc(transactionId));
        }
        return realizedGainMapper.toDomainList(realizedGainJpaRepository.findByAcquisitionIdOrderByIdAsc(transactionId));
    }

    /**
     * Deletes an acquisition none of whose quantity has been consumed, together with its
     * audit history.
     *
     * @throws EditRejectedException for a disposal or a (partly) consumed acquisition
     */
    public void deleteAcquisition(Long id) {
        atomicOperationRunner.runAtomically("deleteAcquisition", () -> {
            LedgerTransaction transaction = getTransaction(id);
            if (transaction.isDisposal()) {
                throw new EditRejectedException(EditViolation.builder()
                        .rule(EditRule.DISPOSAL_DELETE)
                        .field(EditRule.DISPOSAL_DELETE.getField())
                        .message("Disposal " + id + " cannot be deleted; its matches are permanent")
                        .build());
            }
            BigDecimal consumed = lotLedger.consumedQuantity(id);
            if (consumed.signum() > 0) {
                throw new EditRejectedException(EditViolation.builder()
                        .rule(EditRule.CONSUMED_ACQUISITION_DELETE)
                        .field(EditRule.CONSUMED_ACQUISITION_DELETE.getField())
                        .message("Acquisition " + id + " has " + consumed.toPlainString()
                                + " units matched against disposals and cannot be deleted")
                        .quantityBound(consumed)
                        .build());
            }

            ledgerTransactionJpaRepository.deleteById(id);
            ledgerTransactionJpaRepository.flush();
            auditService.deleteHistory(id);
            return transaction;
        });
        log.info("Deleted acquisition {}", id);
    }
}
