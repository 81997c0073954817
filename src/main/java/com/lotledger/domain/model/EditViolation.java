package com.lotledger.domain.model;

import com.lotledger.domain.enums.EditRule;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Why an edit was rejected, with the bound the caller has to respect to get it accepted.
 *
 * <p>Quantity rules fill {@code quantityBound} (e.g. the minimum permitted quantity), date rules
 * fill {@code dateBound} (the latest or earliest permitted date).
 */
@Data
@Builder
public class EditViolation {

    private EditRule rule;
    private String field;
    private String message;
    private BigDecimal quantityBound;
    private LocalDate dateBound;

    /** Transactions whose recorded matches would be broken by the edit. */
    private List<Long> conflictingRecordIds;
}
