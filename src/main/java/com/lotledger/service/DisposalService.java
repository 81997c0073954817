package com.lotledger.service;

import com.lotledger.domain.enums.GainBucket;
import com.lotledger.domain.enums.TransactionType;
import com.lotledger.domain.model.DisposalResult;
import com.lotledger.domain.model.Lot;
import com.lotledger.domain.model.MatchResult;
import com.lotledger.domain.model.MatchedLot;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.entity.LedgerTransactionEntity;
import com.lotledger.exception.InsufficientInventoryException;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.exception.ResourceNotFoundException;
import com.lotledger.ledger.LotLedger;
import com.lotledger.ledger.TransactionValidator;
import com.lotledger.mapper.LedgerTransactionMapper;
import com.lotledger.mapper.RealizedGainMapper;
import com.lotledger.matching.FifoMatcher;
import com.lotledger.matching.MatchRederiver;
import com.lotledger.repository.AtomicOperationRunner;
import com.lotledger.repository.jpa.LedgerTransactionJpaRepository;
import com.lotledger.repository.jpa.RealizedGainJpaRepository;
import com.lotledger.tax.GainClassifier;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records a disposal and the realized gains it produces as one atomic operation.
 *
 * <p>Flow: validate arguments, read the lots held at the disposal date, match them FIFO,
 * insert the disposal, classify each matched lot and insert one realized gain per lot.
 * Any failure rolls the whole operation back, so a disposal never exists without the gains
 * that account for its full quantity.
 *
 * <p>A backdated disposal (one dated before an already recorded disposal of the same
 * instrument) is inserted first and then every disposal from its date onwards is matched
 * again in date order by the {@link MatchRederiver}. The backdated disposal takes the oldest
 * lots, and the later disposals move on to the lots after them.
 */
@Service
public class DisposalService {

    private static final Logger log = LoggerFactory.getLogger(DisposalService.class);

    private final LotLedger lotLedger;
    private final FifoMatcher fifoMatcher;
    private final GainClassifier gainClassifier;
    private final MatchRederiver matchRederiver;
    private final TransactionValidator transactionValidator;
    private final LedgerTransactionJpaRepository ledgerTransactionJpaRepository;
    private final RealizedGainJpaRepository realizedGainJpaRepository;
    private final LedgerTransactionMapper ledgerTransactionMapper;
    private final RealizedGainMapper realizedGainMapper;
    private final AtomicOperationRunner atomicOperationRunner;

    public DisposalService(
            LotLedger lotLedger,
            FifoMatcher fifoMatcher,
            GainClassifier gainClassifier,
            MatchRederiver matchRederiver,
            TransactionValidator transactionValidator,
            LedgerTransactionJpaRepository ledgerTransactionJpaRepository,
            RealizedGainJpaRepository realizedGainJpaRepository,
            LedgerTransactionMapper ledgerTransactionMapper,
            RealizedGainMapper realizedGainMapper,
            AtomicOperationRunner atomicOperationRunner) {
        this.lotLedger = lotLedger;
        this.fifoMatcher = fifoMatcher;
        this.gainClassifier = gainClassifier;
        this.matchRederiver = matchRederiver;
        this.transactionValidator = transactionValidator;
        this.ledgerTransactionJpaRepository = ledgerTransactionJpaRepository;
        this.realizedGainJpaRepository = realizedGainJpaRepository;
        this.ledgerTransactionMapper = ledgerTransactionMapper;
        this.realizedGainMapper = realizedGainMapper;
        this.atomicOperationRunner = atomicOperationRunner;
    }

    public DisposalResult recordDisposal(
            String instrumentId, BigDecimal quantity, BigDecimal unitPrice, LocalDate date) {
        return recordDisposal(instrumentId, quantity, unitPrice, date, null, null);
    }

    /**
     * @throws InvalidArgumentException      for malformed arguments
     * @throws ResourceNotFoundException     if the instrument has no acquisitions
     * @throws InsufficientInventoryException if the lots held at {@code date} cover less than
     *                                       {@code quantity}, or a backdated disposal leaves a
     *                                       later disposal short; nothing is written
     */
    public DisposalResult recordDisposal(
            String instrumentId,
            BigDecimal quantity,
            BigDecimal unitPrice,
            LocalDate date,
            BigDecimal charges,
            String notes) {
        transactionValidator.validate(instrumentId, quantity, unitPrice, date, charges);

        DisposalResult result = atomicOperationRunner.runAtomically("recordDisposal", () -> {
            List<Lot> lots = lotLedger.availableLotsAsOf(instrumentId, date);
            boolean backdated = ledgerTransactionJpaRepository.existsByInstrumentIdAndTransactionTypeAndTransactionDateAfter(
                    instrumentId, TransactionType.SELL, date);
            LocalDateTime now = LocalDateTime.now();

            if (backdated) {
                return recordBackdated(instrumentId, quantity, unitPrice, date, charges, notes, now);
            }

            MatchResult match = fifoMatcher.match(instrumentId, lots, quantity, date, unitPrice);
            LedgerTransactionEntity disposal = ledgerTransactionJpaRepository.save(
                    newDisposal(instrumentId, quantity, unitPrice, date, charges, notes, now));

            List<RealizedGain> gains = new ArrayList<>();
            for (MatchedLot matchedLot : match.getMatchedLots()) {
                gains.add(gainClassifier.toRealizedGain(instrumentId, disposal.getId(), matchedLot, now));
            }
            List<RealizedGain> savedGains = realizedGainMapper.toDomainList(
                    realizedGainJpaRepository.saveAll(realizedGainMapper.toEntityList(gains)));

            return DisposalResult.builder()
                    .disposal(ledgerTransactionMapper.toDomain(disposal))
                    .realizedGains(savedGains)
                    .totalCost(match.getTotalCost())
                    .totalProceeds(match.getTotalProceeds())
                    .totalGain(match.getTotalGain())
                    .shortTermGain(sumGain(savedGains, GainBucket.SHORT))
                    .longTermGain(sumGain(savedGains, GainBucket.LONG))
                    .rematchedDisposalIds(List.of())
                    .recordedAt(now)
                    .build();
        });

        log.info(
                "Recorded disposal {}: {} x {} @ {} on {}, {} lots matched, gain {}",
                result.getDisposal().getId(),
                instrumentId,
                quantity.toPlainString(),
                unitPrice.toPlainString(),
                date,
                result.getRealizedGains().size(),
                result.getTotalGain().toPlainString());
        return result;
    }

    private DisposalResult recordBackdated(
            String instrumentId,
            BigDecimal quantity,
            BigDecimal unitPrice,
            LocalDate date,
            BigDecimal charges,
            String notes,
            LocalDateTime now) {
        LedgerTransactionEntity disposal = ledgerTransactionJpaRepository.save(
                newDisposal(instrumentId, quantity, unitPrice, date, charges, notes, now));

        List<RealizedGain> rederived = matchRederiver.rederive(instrumentId, date);
        List<RealizedGain> gains = rederived.stream()
                .filter(g -> Objects.equals(g.getDisposalId(), disposal.getId()))
                .collect(Collectors.toList());
        List<Long> rematched = rederived.stream()
                .map(RealizedGain::getDisposalId)
                .filter(id -> !Objects.equals(id, disposal.getId()))
                .distinct()
                .collect(Collectors.toList());

        BigDecimal totalCost = sum(gains, RealizedGain::getCostBasis);
        BigDecimal totalProceeds = sum(gains, RealizedGain::getProceeds);
        log.info("Backdated disposal {} of {} on {} re-matched disposals {}", disposal.getId(), instrumentId, date, rematched);

        return DisposalResult.builder()
                .disposal(ledgerTransactionMapper.toDomain(disposal))
                .realizedGains(gains)
                .totalCost(totalCost)
                .totalProceeds(totalProceeds)
                .totalGain(totalProceeds.subtract(totalCost))
                .shortTermGain(sumGain(gains, GainBucket.SHORT))
                .longTermGain(sumGain(gains, GainBucket.LONG))
                .rematchedDisposalIds(rematched)
                .recordedAt(now)
                .build();
    }

    private LedgerTransactionEntity newDisposal(
            String instrumentId,
            BigDecimal quantity,
            BigDecimal unitPrice,
            LocalDate date,
            BigDecimal charges,
            String notes,
            LocalDateTime now) {
        return LedgerTransactionEntity.builder()
                .instrumentId(instrumentId)
                .transactionType(TransactionType.SELL)
                .transactionDate(date)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .charges(charges != null ? charges : BigDecimal.ZERO)
                .notes(notes)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private BigDecimal sumGain(List<RealizedGain> gains, GainBucket bucket) {
        return gains.stream()
                .filter(g -> g.getBucket() == bucket)
                .map(RealizedGain::getGainAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal sum(List<RealizedGain> gains, Function<RealizedGain, BigDecimal> amount) {
        return gains.stream().map(amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
