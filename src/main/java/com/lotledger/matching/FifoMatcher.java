package com.lotledger.matching;

import com.lotledger.domain.model.Lot;
import com.lotledger.domain.model.MatchResult;
import com.lotledger.domain.model.MatchedLot;
import com.lotledger.exception.InsufficientInventoryException;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.ledger.TransactionValidator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Consumes acquisition lots oldest-first against a disposal.
 *
 * <p>The lots are walked in the order given (the ledger already returns them in FIFO order);
 * the matcher never re-orders them. Each step takes {@code min(remaining, lot.available)}
 * and emits one {@link MatchedLot}. The total available quantity is checked before anything
 * is emitted, so a short disposal produces no partial result.
 *
 * <p>Pure computation: no storage access, no side effects on the given lots.
 */
@Component
public class FifoMatcher {

    private static final int MONEY_SCALE = 8;

    public MatchResult match(
            List<Lot> lots, BigDecimal disposalQuantity, LocalDate disposalDate, BigDecimal disposalUnitPrice) {
        return match(null, lots, disposalQuantity, disposalDate, disposalUnitPrice);
    }

    /**
     * @param instrumentId instrument being disposed of, reported in an insufficient inventory error
     * @throws InvalidArgumentException      for a non-positive quantity or price, a missing date,
     *                                       or a lot dated after the disposal
     * @throws InsufficientInventoryException if the lots hold less than {@code disposalQuantity}
     */
    public MatchResult match(
            String instrumentId,
            List<Lot> lots,
            BigDecimal disposalQuantity,
            LocalDate disposalDate,
            BigDecimal disposalUnitPrice) {
        TransactionValidator.requirePositive("quantity", disposalQuantity);
        TransactionValidator.requirePositive("unitPrice", disposalUnitPrice);
        if (disposalDate == null) {
            throw new InvalidArgumentException("transactionDate", "Disposal date is required");
        }

        BigDecimal totalAvailable = BigDecimal.ZERO;
        for (Lot lot : lots) {
            if (lot.getDate().isAfter(disposalDate)) {
                throw new InvalidArgumentException(
                        "lots",
                        "Lot " + lot.getAcquisitionId() + " dated " + lot.getDate()
                                + " is after the disposal date " + disposalDate);
            }
            totalAvailable = totalAvailable.add(lot.getAvailable());
        }
        if (totalAvailable.compareTo(disposalQuantity) < 0) {
            throw new InsufficientInventoryException(instrumentId, disposalQuantity, totalAvailable);
        }

        List<MatchedLot> matchedLots = new ArrayList<>();
        BigDecimal remaining = disposalQuantity;
        BigDecimal totalCost = BigDecimal.ZERO;
        BigDecimal totalProceeds = BigDecimal.ZERO;

        for (Lot lot : lots) {
            if (remaining.signum() == 0) {
                break;
            }
            if (lot.getAvailable().signum() <= 0) {
                continue;
            }
            BigDecimal quantity = remaining.min(lot.getAvailable());
            BigDecimal cost = quantity.multiply(lot.getUnitPrice()).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
            BigDecimal proceeds = quantity.multiply(disposalUnitPrice).setScale(MONEY_SCALE, RoundingMode.HALF_UP);

            matchedLots.add(MatchedLot.builder()
                    .acquisitionId(lot.getAcquisitionId())
                    .acquisitionDate(lot.getDate())
                    .disposalDate(disposalDate)
                    .quantity(quantity)
                    .unitCostBasis(lot.getUnitPrice())
                    .unitProceeds(disposalUnitPrice)
                    .cost(cost)
                    .proceeds(proceeds)
                    .gain(proceeds.subtract(cost))
                    .holdingPeriodDays(ChronoUnit.DAYS.between(lot.getDate(), disposalDate))
                    .build());

            totalCost = totalCost.add(cost);
            totalProceeds = totalProceeds.add(proceeds);
            remaining = remaining.subtract(quantity);
        }

        return MatchResult.builder()
                .matchedLots(matchedLots)
                .totalQuantity(disposalQuantity)
                .totalCost(totalCost)
                .totalProceeds(totalProceeds)
                .totalGain(totalProceeds.subtract(totalCost))
                .averageCost(totalCost.divide(disposalQuantity, MONEY_SCALE, RoundingMode.HALF_UP))
                .build();
    }
}
