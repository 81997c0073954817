package com.lotledger.service;

import com.lotledger.domain.enums.EditRule;
import com.lotledger.domain.enums.TransactionType;
import com.lotledger.domain.model.EditViolation;
import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.ledger.LotLedger;
import com.lotledger.mapper.RealizedGainMapper;
import com.lotledger.repository.jpa.RealizedGainJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Decides whether a proposed modification of a transaction is compatible with the matches
 * already recorded against it.
 *
 * <p>Rules are checked in a fixed order and the first failing rule wins:
 * <ol>
 *   <li>{@link EditRule#QUANTITY_BELOW_MATCHED}: an acquisition cannot shrink below what has been
 *       matched from it.</li>
 *   <li>{@link EditRule#ACQUISITION_DATE_AFTER_DISPOSAL}: an acquisition cannot move past a
 *       disposal that consumed it.</li>
 *   <li>{@link EditRule#DISPOSAL_DATE_BEFORE_ACQUISITION}: a disposal cannot move before an
 *       acquisition it consumed.</li>
 *   <li>{@link EditRule#INSUFFICIENT_INVENTORY_FOR_TYPE_CHANGE}: an acquisition can only become a
 *       disposal if enough inventory is held before its date.</li>
 *   <li>{@link EditRule#MATCHED_DISPOSAL_TYPE_CHANGE}: a matched disposal cannot become an
 *       acquisition.</li>
 *   <li>{@link EditRule#MATCHED_DISPOSAL_INSTRUMENT_CHANGE}: a matched disposal cannot move to
 *       another instrument.</li>
 * </ol>
 *
 * <p>Read-only: validating never writes anything.
 */
@Service
public class EditValidator {

    private final RealizedGainJpaRepository realizedGainJpaRepository;
    private final RealizedGainMapper realizedGainMapper;
    private final LotLedger lotLedger;

    public EditValidator(
            RealizedGainJpaRepository realizedGainJpaRepository,
            RealizedGainMapper realizedGainMapper,
            LotLedger lotLedger) {
        this.realizedGainJpaRepository = realizedGainJpaRepository;
        this.realizedGainMapper = realizedGainMapper;
        this.lotLedger = lotLedger;
    }

    /** Returns the first violated rule, or empty when the edit may be committed. */
    public Optional<EditViolation> validate(LedgerTransaction original, LedgerTransaction proposed) {
        if (original.isAcquisition()) {
            return validateAcquisition(original, proposed);
        }
        return validateDisposal(original, proposed);
    }

    private Optional<EditViolation> validateAcquisition(LedgerTransaction original, LedgerTransaction proposed) {
        List<RealizedGain> matches =
                realizedGainMapper.toDomainList(realizedGainJpaRepository.findByAcquisitionIdOrderByIdAsc(original.getId()));
        BigDecimal matched = sumQuantity(matches);

        if (proposed.getQuantity().compareTo(matched) < 0) {
            return Optional.of(violation(
                    EditRule.QUANTITY_BELOW_MATCHED,
                    String.format(
                            "Quantity cannot be reduced to %s: %s units are already matched against disposals",
                            proposed.getQuantity().toPlainString(),
                            matched.toPlainString()),
                    matched,
                    null,
                    distinctIds(matches, RealizedGain::getDisposalId)));
        }

        if (!original.getTransactionDate().equals(proposed.getTransactionDate())) {
            List<RealizedGain> conflicts = matches.stream()
                    .filter(g -> g.getDisposalDate().isBefore(proposed.getTransactionDate()))
                    .collect(Collectors.toList());
            if (!conflicts.isEmpty()) {
                LocalDate earliestDisposal = matches.stream()
                        .map(RealizedGain::getDisposalDate)
                        .min(Comparator.naturalOrder())
                        .orElseThrow();
                return Optional.of(violation(
                        EditRule.ACQUISITION_DATE_AFTER_DISPOSAL,
                        String.format(
                                "Acquisition date cannot move to %s: it is matched against a disposal dated %s",
                                proposed.getTransactionDate(),
                                earliestDisposal),
                        null,
                        earliestDisposal,
                        distinctIds(conflicts, RealizedGain::getDisposalId)));
            }
        }

        if (proposed.getTransactionType() == TransactionType.SELL) {
            BigDecimal available = lotLedger
                    .availableBefore(proposed.getInstrumentId(), proposed.getTransactionDate(), original.getId())
                    .max(BigDecimal.ZERO);
            if (available.compareTo(proposed.getQuantity()) < 0) {
                return Optional.of(violation(
                        EditRule.INSUFFICIENT_INVENTORY_FOR_TYPE_CHANGE,
                        String.format(
                                "Cannot change to a disposal of %s: only %s units of %s are held before %s",
                                proposed.getQuantity().toPlainString(),
                                available.toPlainString(),
                                proposed.getInstrumentId(),
                                proposed.getTransactionDate()),
                        available,
                        null,
                        distinctIds(matches, RealizedGain::getDisposalId)));
            }
        }
        return Optional.empty();
    }

    private Optional<EditViolation> validateDisposal(LedgerTransaction original, LedgerTransaction proposed) {
        List<RealizedGain> matches =
                realizedGainMapper.toDomainList(realizedGainJpaRepository.findByDisposalIdOrderByIdAsc(original.getId()));
        BigDecimal matched = sumQuantity(matches);

        if (!original.getTransactionDate().equals(proposed.getTransactionDate())) {
            List<RealizedGain> conflicts = matches.stream()
                    .filter(g -> g.getAcquisitionDate().isAfter(proposed.getTransactionDate()))
                    .collect(Collectors.toList());
            if (!conflicts.isEmpty()) {
                LocalDate latestAcquisition = matches.stream()
                        .map(RealizedGain::getAcquisitionDate)
                        .max(Comparator.naturalOrder())
                        .orElseThrow();
                return Optional.of(violation(
                        EditRule.DISPOSAL_DATE_BEFORE_ACQUISITION,
                        String.format(
                                "Disposal date cannot move to %s: it consumed an acquisition dated %s",
                                proposed.getTransactionDate(),
                                latestAcquisition),
                        null,
                        latestAcquisition,
                        distinctIds(conflicts, RealizedGain::getAcquisitionId)));
            }
        }

        if (proposed.getTransactionType() == TransactionType.BUY && !matches.isEmpty()) {
            return Optional.of(violation(
                    EditRule.MATCHED_DISPOSAL_TYPE_CHANGE,
                    "A disposal with recorded matches cannot be changed to an acquisition",
                    matched,
                    null,
                    distinctIds(matches, RealizedGain::getAcquisitionId)));
        }

        if (!Objects.equals(original.getInstrumentId(), proposed.getInstrumentId()) && !matches.isEmpty()) {
            return Optional.of(violation(
                    EditRule.MATCHED_DISPOSAL_INSTRUMENT_CHANGE,
                    "A disposal with recorded matches cannot be moved to instrument " + proposed.getInstrumentId(),
                    matched,
                    null,
                    distinctIds(matches, RealizedGain::getAcquisitionId)));
        }
        return Optional.empty();
    }

    private EditViolation violation(
            EditRule rule, String message, BigDecimal quantityBound, LocalDate dateBound, List<Long> conflicts) {
        return EditViolation.builder()
                .rule(rule)
                .field(rule.getField())
                .message(message)
                .quantityBound(quantityBound)
                .dateBound(dateBound)
                .conflictingRecordIds(conflicts)
                .build();
    }

    private BigDecimal sumQuantity(List<RealizedGain> gains) {
        return gains.stream().map(RealizedGain::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private List<Long> distinctIds(List<RealizedGain> gains, Function<RealizedGain, Long> id) {
        return gains.stream().map(id).distinct().collect(Collectors.toList());
    }
}
