package com.lotledger.exception;

import com.lotledger.domain.enums.EditRule;
import com.lotledger.domain.model.EditViolation;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * A modification (or deletion) would corrupt recorded FIFO matches. The attached
 * {@link EditViolation} names the rule and the bound the request exceeded.
 */
@Getter
public class EditRejectedException extends BaseException {

    private final EditViolation violation;

    public EditRejectedException(EditViolation violation) {
        super(ErrorCode.EDIT_REJECTED, violation.getMessage(), toDetails(violation));
        this.violation = violation;
    }

    public EditRule getRule() {
        return violation.getRule();
    }

    private static Map<String, Object> toDetails(EditViolation violation) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rule", violation.getRule().name());
        details.put("field", violation.getField());
        if (violation.getQuantityBound() != null) {
            details.put("quantityBound", violation.getQuantityBound());
        }
        if (violation.getDateBound() != null) {
            details.put("dateBound", violation.getDateBound().toString());
        }
        if (violation.getConflictingRecordIds() != null && !violation.getConflictingRecordIds().isEmpty()) {
            details.put("conflictingRecordIds", violation.getConflictingRecordIds());
        }
        return details;
    }
}
