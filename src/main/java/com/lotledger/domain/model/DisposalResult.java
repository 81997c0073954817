package com.lotledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Everything a recorded disposal produced. Callers that react to ledger changes use this
 * return value instead of listening for a change event.
 */
@Data
@Builder
public class DisposalResult {

    private LedgerTransaction disposal;
    private List<RealizedGain> realizedGains;
    private BigDecimal totalCost;
    private BigDecimal totalProceeds;
    private BigDecimal totalGain;
    private BigDecimal shortTermGain;
    private BigDecimal longTermGain;

    /** Later disposals whose matches moved because this one was backdated before them. */
    private List<Long> rematchedDisposalIds;

    private LocalDateTime recordedAt;
}
