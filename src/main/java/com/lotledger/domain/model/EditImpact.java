package com.lotledger.domain.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * What committing a proposed edit would touch: net quantity held per affected instrument
 * before and after, and how many other records of those instruments sit on or after the
 * earlier of the old and new date (the records whose matches would be re-derived).
 */
@Data
@Builder
public class EditImpact {

    private Set<String> affectedInstrumentIds;
    private Map<String, BigDecimal> holdingsBefore;
    private Map<String, BigDecimal> holdingsAfter;
    private Map<String, BigDecimal> holdingsDelta;
    private long affectedTransactionCount;

    /** False for edits that only touch notes or charges. */
    private boolean rederivationRequired;
}
