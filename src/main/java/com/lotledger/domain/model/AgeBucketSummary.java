package com.lotledger.domain.model;

import com.lotledger.domain.enums.LotAgeBucket;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AgeBucketSummary {

    private LotAgeBucket bucket;
    private String label;
    private BigDecimal quantity;

    /** Share of the total open quantity, 0-100 with two decimals. */
    private BigDecimal percentage;
}
