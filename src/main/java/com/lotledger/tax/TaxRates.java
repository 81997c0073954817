package com.lotledger.tax;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable tax parameters for the two-bucket holding-period model.
 *
 * <p>Rates are fractions (0.20 = 20%). The long-term exemption is applied once per aggregation
 * period (financial year) to the pooled long-term gains.
 */
@Value
@Builder
public class TaxRates {

    BigDecimal shortTermRate;
    BigDecimal longTermRate;
    BigDecimal longTermExemption;
}
