package com.lotledger.config;

import com.lotledger.tax.TaxRates;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link TaxRates} bean from application.properties.
 *
 * <p>Properties prefix: {@code lotledger.tax.*}
 */
@Configuration
public class TaxConfig {

    @Bean
    public TaxRates taxRates(
            @Value("${lotledger.tax.short-term-rate:0.20}") BigDecimal shortTermRate,
            @Value("${lotledger.tax.long-term-rate:0.10}") BigDecimal longTermRate,
            @Value("${lotledger.tax.long-term-exemption:100000}") BigDecimal longTermExemption) {
        return TaxRates.builder()
                .shortTermRate(shortTermRate)
                .longTermRate(longTermRate)
                .longTermExemption(longTermExemption)
                .build();
    }
}
