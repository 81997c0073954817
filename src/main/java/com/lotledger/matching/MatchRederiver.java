package com.lotledger.matching;

import com.lotledger.domain.enums.TransactionType;
import com.lotledger.domain.model.Lot;
import com.lotledger.domain.model.MatchResult;
import com.lotledger.domain.model.MatchedLot;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.entity.LedgerTransactionEntity;
import com.lotledger.exception.InsufficientInventoryException;
import com.lotledger.mapper.RealizedGainMapper;
import com.lotledger.repository.jpa.LedgerTransactionJpaRepository;
import com.lotledger.repository.jpa.RealizedGainJpaRepository;
import com.lotledger.tax.GainClassifier;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Re-runs FIFO matching for one instrument from a given date forward.
 *
 * <p>Used inside the commit of an accepted edit and when a disposal is recorded before an
 * already recorded one: the realized gains of every disposal dated on or after {@code fromDate}
 * are deleted, then those disposals are matched again in date order against the acquisitions as
 * they now stand. Matches of earlier disposals are left untouched.
 * Each disposal only consumes lots dated on or before its own date.
 *
 * <p>Must run inside the caller's atomic operation: a disposal that can no longer be matched
 * raises {@link InsufficientInventoryException} after the old gains were already deleted.
 */
@Service
public class MatchRederiver {

    private static final Logger log = LoggerFactory.getLogger(MatchRederiver.class);

    private final LedgerTransactionJpaRepository ledgerTransactionJpaRepository;
    private final RealizedGainJpaRepository realizedGainJpaRepository;
    private final RealizedGainMapper realizedGainMapper;
    private final FifoMatcher fifoMatcher;
    private final GainClassifier gainClassifier;

    public MatchRederiver(
            LedgerTransactionJpaRepository ledgerTransactionJpaRepository,
            RealizedGainJpaRepository realizedGainJpaRepository,
            RealizedGainMapper realizedGainMapper,
            FifoMatcher fifoMatcher,
            GainClassifier gainClassifier) {
        this.ledgerTransactionJpaRepository = ledgerTransactionJpaRepository;
        this.realizedGainJpaRepository = realizedGainJpaRepository;
        this.realizedGainMapper = realizedGainMapper;
        this.fifoMatcher = fifoMatcher;
        this.gainClassifier = gainClassifier;
    }

    /**
     * @return the realized gains written for the re-matched disposals
     * @throws InsufficientInventoryException if a disposal cannot be fully matched any more
     */
    public List<RealizedGain> rederive(String instrumentId, LocalDate fromDate) {
        List<LedgerTransactionEntity> transactions =
                ledgerTransactionJpaRepository.findByInstrumentIdOrderByTransactionDateAscIdAsc(instrumentId);

        List<LedgerTransactionEntity> disposals = transactions.stream()
                .filter(t -> t.getTransactionType() == TransactionType.SELL)
                .filter(t -> !t.getTransactionDate().isBefore(fromDate))
                .collect(Collectors.toList());
        if (disposals.isEmpty()) {
            log.debug("No disposals of {} on or after {}, nothing to re-derive", instrumentId, fromDate);
            return Collections.emptyList();
        }

        int deleted = realizedGainJpaRepository.deleteByDisposalIds(
                disposals.stream().map(LedgerTransactionEntity::getId).collect(Collectors.toList()));

        List<LedgerTransactionEntity> acquisitions = transactions.stream()
                .filter(t -> t.getTransactionType() == TransactionType.BUY)
                .collect(Collectors.toList());
        Map<Long, BigDecimal> available = remainingAvailability(acquisitions);

        LocalDateTime now = LocalDateTime.now();
        List<RealizedGain> written = new ArrayList<>();
        for (LedgerTransactionEntity disposal : disposals) {
            List<Lot> lots = lotsAsOf(acquisitions, available, disposal.getTransactionDate());
            MatchResult result = fifoMatcher.match(
                    instrumentId, lots, disposal.getQuantity(), disposal.getTransactionDate(), disposal.getUnitPrice());

            for (MatchedLot matchedLot : result.getMatchedLots()) {
                available.merge(matchedLot.getAcquisitionId(), matchedLot.getQuantity().negate(), BigDecimal::add);
                written.add(gainClassifier.toRealizedGain(instrumentId, disposal.getId(), matchedLot, now));
            }
        }

        List<RealizedGain> saved = realizedGainMapper.toDomainList(
                realizedGainJpaRepository.saveAll(realizedGainMapper.toEntityList(written)));
        log.info(
                "Re-derived {} disposals of {} from {}: {} gains replaced by {}",
                disposals.size(),
                instrumentId,
                fromDate,
                deleted,
                saved.size());
        return saved;
    }

    /** Quantity still available per acquisition once the deleted matches are gone. */
    private Map<Long, BigDecimal> remainingAvailability(List<LedgerTransactionEntity> acquisitions) {
        Map<Long, BigDecimal> available = new HashMap<>();
        if (acquisitions.isEmpty()) {
            return available;
        }
        for (LedgerTransactionEntity acquisition : acquisitions) {
            available.put(acquisition.getId(), acquisition.getQuantity());
        }
        List<Long> ids = new ArrayList<>(available.keySet());
        for (Object[] row : realizedGainJpaRepository.sumQuantityGroupedByAcquisitionId(ids)) {
            available.merge((Long) row[0], ((BigDecimal) row[1]).negate(), BigDecimal::add);
        }
        return available;
    }

    private List<Lot> lotsAsOf(
            List<LedgerTransactionEntity> acquisitions, Map<Long, BigDecimal> available, LocalDate date) {
        List<Lot> lots = new ArrayList<>();
        for (LedgerTransactionEntity acquisition : acquisitions) {
            BigDecimal remaining = available.get(acquisition.getId());
            if (!acquisition.getTransactionDate().isAfter(date) && remaining.signum() > 0) {
                lots.add(Lot.builder()
                        .acquisitionId(acquisition.getId())
                        .date(acquisition.getTransactionDate())
                        .unitPrice(acquisition.getUnitPrice())
                        .quantity(acquisition.getQuantity())
                        .available(remaining)
                        .build());
            }
        }
        return lots;
    }
}
