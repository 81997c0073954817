package com.lotledger.ledger;

import com.lotledger.domain.enums.LotAgeBucket;
import com.lotledger.domain.enums.TransactionType;
import com.lotledger.domain.model.AgeBucketSummary;
import com.lotledger.domain.model.AgedLot;
import com.lotledger.domain.model.Holding;
import com.lotledger.domain.model.Lot;
import com.lotledger.domain.model.LotAgeDistribution;
import com.lotledger.entity.LedgerTransactionEntity;
import com.lotledger.exception.ResourceNotFoundException;
import com.lotledger.repository.jpa.LedgerTransactionJpaRepository;
import com.lotledger.repository.jpa.RealizedGainJpaRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Read-only view over the acquisitions of an instrument and the quantity already consumed
 * from each.
 *
 * <p>Availability is derived on every call: {@code available = quantity - sum(matched quantity)}
 * over the realized gains drawn from the acquisition. Nothing is cached between calls, so a
 * read inside an atomic operation sees the rows written earlier in the same operation.
 *
 * <p>Lots are returned in FIFO order (acquisition date ascending, ties broken by id, which is
 * the insertion order).
 */
@Service
public class LotLedger {

    private static final int MONEY_SCALE = 8;

    private final LedgerTransactionJpaRepository ledgerTransactionJpaRepository;
    private final RealizedGainJpaRepository realizedGainJpaRepository;

    public LotLedger(
            LedgerTransactionJpaRepository ledgerTransactionJpaRepository,
            RealizedGainJpaRepository realizedGainJpaRepository) {
        this.ledgerTransactionJpaRepository = ledgerTransactionJpaRepository;
        this.realizedGainJpaRepository = realizedGainJpaRepository;
    }

    /**
     * Lots with available quantity, oldest first.
     *
     * @throws ResourceNotFoundException if the instrument has no acquisitions at all
     */
    public List<Lot> availableLots(String instrumentId) {
        List<LedgerTransactionEntity> acquisitions = acquisitionsOf(instrumentId);
        if (acquisitions.isEmpty()) {
            throw new ResourceNotFoundException("Acquisitions for instrument", instrumentId);
        }
        return openLots(acquisitions);
    }

    /** The available lots acquired on or before {@code date}: the inventory held at that date. */
    public List<Lot> availableLotsAsOf(String instrumentId, LocalDate date) {
        return availableLots(instrumentId).stream()
                .filter(lot -> !lot.getDate().isAfter(date))
                .collect(Collectors.toList());
    }

    public BigDecimal consumedQuantity(Long acquisitionId) {
        return realizedGainJpaRepository.sumQuantityByAcquisitionId(acquisitionId);
    }

    /**
     * Net quantity held strictly before {@code date}: acquisitions before the date (excluding
     * {@code excludedId}) minus disposals before the date.
     */
    public BigDecimal availableBefore(String instrumentId, LocalDate date, Long excludedId) {
        BigDecimal acquired =
                ledgerTransactionJpaRepository.sumQuantityBefore(instrumentId, TransactionType.BUY, date);
        BigDecimal disposed =
                ledgerTransactionJpaRepository.sumQuantityBefore(instrumentId, TransactionType.SELL, date);

        if (excludedId != null) {
            BigDecimal excluded = ledgerTransactionJpaRepository
                    .findById(excludedId)
                    .filter(t -> t.getTransactionType() == TransactionType.BUY)
                    .filter(t -> instrumentId.equals(t.getInstrumentId()))
                    .filter(t -> t.getTransactionDate().isBefore(date))
                    .map(LedgerTransactionEntity::getQuantity)
                    .orElse(BigDecimal.ZERO);
            acquired = acquired.subtract(excluded);
        }
        return acquired.subtract(disposed);
    }

    /** Open quantity, remaining cost basis and average cost over the open lots. */
    public Holding holding(String instrumentId) {
        List<Lot> lots = availableLots(instrumentId);

        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal costBasis = BigDecimal.ZERO;
        for (Lot lot : lots) {
            quantity = quantity.add(lot.getAvailable());
            costBasis = costBasis.add(lot.getAvailable().multiply(lot.getUnitPrice()));
        }
        costBasis = costBasis.setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        return Holding.builder()
                .instrumentId(instrumentId)
                .quantity(quantity)
                .costBasis(costBasis)
                .averageCost(
                        quantity.signum() > 0
                                ? costBasis.divide(quantity, MONEY_SCALE, RoundingMode.HALF_UP)
                                : BigDecimal.ZERO)
                .openLots(lots.size())
                .build();
    }

    /** The holding valued at a caller-supplied market price. */
    public Holding unrealizedGain(String instrumentId, BigDecimal marketPrice) {
        TransactionValidator.requirePositive("marketPrice", marketPrice);

        Holding holding = holding(instrumentId);
        BigDecimal marketValue =
                holding.getQuantity().multiply(marketPrice).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal unrealized = marketValue.subtract(holding.getCostBasis());

        holding.setMarketPrice(marketPrice);
        holding.setMarketValue(marketValue);
        holding.setUnrealizedGain(unrealized);
        if (holding.getCostBasis().signum() > 0) {
            holding.setUnrealizedGainPercent(unrealized
                    .multiply(BigDecimal.valueOf(100))
                    .divide(holding.getCostBasis(), 4, RoundingMode.HALF_UP));
        }
        return holding;
    }

    /**
     * Open quantity by lot age at {@code asOf}, across the instrument's open lots.
     *
     * @throws ResourceNotFoundException if the instrument has no acquisitions at all
     */
    public LotAgeDistribution ageDistribution(String instrumentId, LocalDate asOf) {
        List<Lot> lots = availableLots(instrumentId);
        return distribution(instrumentId, lots, lots.isEmpty() ? 0 : 1, asOf);
    }

    /** Open quantity by lot age over every instrument; instruments without acquisitions are skipped. */
    public LotAgeDistribution ageDistribution(LocalDate asOf) {
        List<Lot> lots = new ArrayList<>();
        int instrumentCount = 0;
        for (String instrumentId : ledgerTransactionJpaRepository.findDistinctInstrumentIds()) {
            List<Lot> open = openLots(acquisitionsOf(instrumentId));
            if (!open.isEmpty()) {
                instrumentCount++;
                lots.addAll(open);
            }
        }
        return distribution(null, lots, instrumentCount, asOf);
    }

    /**
     * The open lots of one age bucket, oldest first. Market value is filled in when
     * {@code marketPrice} is given.
     */
    public List<AgedLot> lotsInBucket(
            String instrumentId, LotAgeBucket bucket, LocalDate asOf, BigDecimal marketPrice) {
        if (marketPrice != null) {
            TransactionValidator.requirePositive("marketPrice", marketPrice);
        }
        List<AgedLot> aged = new ArrayList<>();
        for (Lot lot : availableLots(instrumentId)) {
            long ageDays = ageDays(lot, asOf);
            if (LotAgeBucket.of(ageDays) != bucket) {
                continue;
            }
            aged.add(AgedLot.builder()
                    .acquisitionId(lot.getAcquisitionId())
                    .instrumentId(instrumentId)
                    .acquisitionDate(lot.getDate())
                    .unitPrice(lot.getUnitPrice())
                    .available(lot.getAvailable())
                    .costBasis(lot.getAvailable().multiply(lot.getUnitPrice()).setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                    .ageDays(ageDays)
                    .bucket(bucket)
                    .marketValue(marketPrice != null
                            ? lot.getAvailable().multiply(marketPrice).setScale(MONEY_SCALE, RoundingMode.HALF_UP)
                            : null)
                    .build());
        }
        return aged;
    }

    private LotAgeDistribution distribution(String instrumentId, List<Lot> lots, int instrumentCount, LocalDate asOf) {
        Map<LotAgeBucket, BigDecimal> byBucket = new EnumMap<>(LotAgeBucket.class);
        BigDecimal total = BigDecimal.ZERO;
        for (Lot lot : lots) {
            byBucket.merge(LotAgeBucket.of(ageDays(lot, asOf)), lot.getAvailable(), BigDecimal::add);
            total = total.add(lot.getAvailable());
        }

        List<AgeBucketSummary> buckets = new ArrayList<>();
        for (LotAgeBucket bucket : LotAgeBucket.values()) {
            BigDecimal quantity = byBucket.getOrDefault(bucket, BigDecimal.ZERO);
            buckets.add(AgeBucketSummary.builder()
                    .bucket(bucket)
                    .label(bucket.getLabel())
                    .quantity(quantity)
                    .percentage(total.signum() > 0
                            ? quantity.multiply(BigDecimal.valueOf(100)).divide(total, 2, RoundingMode.HALF_UP)
                            : BigDecimal.ZERO)
                    .build());
        }
        return LotAgeDistribution.builder()
                .instrumentId(instrumentId)
                .asOf(asOf)
                .totalQuantity(total)
                .instrumentCount(instrumentCount)
                .buckets(buckets)
                .build();
    }

    private static long ageDays(Lot lot, LocalDate asOf) {
        return Math.max(0, ChronoUnit.DAYS.between(lot.getDate(), asOf));
    }

    private List<LedgerTransactionEntity> acquisitionsOf(String instrumentId) {
        return ledgerTransactionJpaRepository
                .findByInstrumentIdAndTransactionTypeOrderByTransactionDateAscIdAsc(instrumentId, TransactionType.BUY);
    }

    private List<Lot> openLots(List<LedgerTransactionEntity> acquisitions) {
        if (acquisitions.isEmpty()) {
            return new ArrayList<>();
        }
        Map<Long, BigDecimal> consumed = consumedByAcquisition(acquisitions);
        List<Lot> lots = new ArrayList<>();
        for (LedgerTransactionEntity acquisition : acquisitions) {
            BigDecimal available =
                    acquisition.getQuantity().subtract(consumed.getOrDefault(acquisition.getId(), BigDecimal.ZERO));
            if (available.signum() > 0) {
                lots.add(Lot.builder()
                        .acquisitionId(acquisition.getId())
                        .date(acquisition.getTransactionDate())
                        .unitPrice(acquisition.getUnitPrice())
                        .quantity(acquisition.getQuantity())
                        .available(available)
                        .build());
            }
        }
        return lots;
    }

    private Map<Long, BigDecimal> consumedByAcquisition(List<LedgerTransactionEntity> acquisitions) {
        List<Long> ids =
                acquisitions.stream().map(LedgerTransactionEntity::getId).collect(Collectors.toList());
        Map<Long, BigDecimal> consumed = new HashMap<>();
        for (Object[] row : realizedGainJpaRepository.sumQuantityGroupedByAcquisitionId(ids)) {
            consumed.put((Long) row[0], (BigDecimal) row[1]);
        }
        return consumed;
    }
}
