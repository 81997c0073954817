package com.lotledger.tax;

import com.lotledger.domain.enums.GainBucket;
import com.lotledger.domain.model.MatchedLot;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.domain.vo.FinancialYear;
import java.time.LocalDateTime;
import org.springframework.stereotype.Component;

/**
 * Assigns the holding-period bucket of a matched lot: LONG when held for more than 365 days,
 * SHORT otherwise (a lot held exactly 365 days is SHORT).
 */
@Component
public class GainClassifier {

    public static final long LONG_TERM_THRESHOLD_DAYS = 365;

    public GainBucket classify(long holdingPeriodDays) {
        return holdingPeriodDays > LONG_TERM_THRESHOLD_DAYS ? GainBucket.LONG : GainBucket.SHORT;
    }

    /** Builds the realized gain record for one matched lot of a disposal. */
    public RealizedGain toRealizedGain(
            String instrumentId, Long disposalId, MatchedLot matchedLot, LocalDateTime createdAt) {
        return RealizedGain.builder()
                .acquisitionId(matchedLot.getAcquisitionId())
                .disposalId(disposalId)
                .instrumentId(instrumentId)
                .quantity(matchedLot.getQuantity())
                .unitCostBasis(matchedLot.getUnitCostBasis())
                .unitProceeds(matchedLot.getUnitProceeds())
                .acquisitionDate(matchedLot.getAcquisitionDate())
                .disposalDate(matchedLot.getDisposalDate())
                .holdingPeriodDays(matchedLot.getHoldingPeriodDays())
                .bucket(classify(matchedLot.getHoldingPeriodDays()))
                .costBasis(matchedLot.getCost())
                .proceeds(matchedLot.getProceeds())
                .gainAmount(matchedLot.getGain())
                .financialYear(FinancialYear.of(matchedLot.getDisposalDate()).getLabel())
                .createdAt(createdAt)
                .build();
    }
}
