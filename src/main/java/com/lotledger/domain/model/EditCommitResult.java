package com.lotledger.domain.model;

import com.lotledger.domain.enums.EditStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/** Outcome of an accepted and committed edit. */
@Data
@Builder
public class EditCommitResult {

    private Long recordId;
    private EditStatus status;
    private LedgerTransaction transaction;

    /** Instruments whose matches were re-derived (old and new instrument on an instrument change). */
    private Set<String> affectedInstrumentIds;

    /** Realized gains written by the re-derivation. */
    private List<RealizedGain> rederivedGains;

    private List<AuditEntry> auditEntries;
    private LocalDateTime committedAt;
}
