package com.lotledger.unit.reporting;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.lotledger.api.controller.ReportsController;
import com.lotledger.domain.vo.TaxEstimate;
import com.lotledger.exception.GlobalExceptionHandler;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.reporting.CapitalGainsReport;
import com.lotledger.reporting.CapitalGainsReportGenerator;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for ReportsController.
 *
 * <p>Verifies: capital gains report by financial year and parameter errors.
 */
class ReportsControllerTest {

    private MockMvc mockMvc;

    @Mock
    private CapitalGainsReportGenerator capitalGainsReportGenerator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ReportsController controller = new ReportsController(capitalGainsReportGenerator);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(
                        Jackson2ObjectMapperBuilder.json()
                                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                .build()))
                .build();
    }

    @Test
    void getCapitalGainsReport_returnsReport() throws Exception {
        CapitalGainsReport report = CapitalGainsReport.builder()
                .financialYear("2024-25")
                .from(LocalDate.of(2024, 4, 1))
                .to(LocalDate.of(2025, 3, 31))
                .shortTermGain(new BigDecimal("25000"))
                .longTermGain(new BigDecimal("150000"))
                .totalProceeds(new BigDecimal("900000"))
                .totalCostBasis(new BigDecimal("725000"))
                .taxEstimate(TaxEstimate.builder()
                        .shortTermGain(new BigDecimal("25000"))
                        .longTermGain(new BigDecimal("150000"))
                        .pooledLongTermGain(new BigDecimal("150000"))
                        .exemptionUsed(new BigDecimal("100000"))
                        .taxableLongTermGain(new BigDecimal("50000"))
                        .shortTax(new BigDecimal("5000"))
                        .longTax(new BigDecimal("5000"))
                        .build())
                .shortTermCount(2)
                .longTermCount(1)
                .gains(List.of())
                .build();

        when(capitalGainsReportGenerator.generate("2024-25")).thenReturn(report);

        mockMvc.perform(get("/api/reports/capital-gains").param("financialYear", "2024-25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.financialYear").value("2024-25"))
                .andExpect(jsonPath("$.from").value("2024-04-01"))
                .andExpect(jsonPath("$.taxEstimate.longTax").value(5000))
                .andExpect(jsonPath("$.taxEstimate.totalTax").value(10000))
                .andExpect(jsonPath("$.shortTermCount").value(2));
    }

    @Test
    void getCapitalGainsReport_missingFinancialYear_returns400() throws Exception {
        mockMvc.perform(get("/api/reports/capital-gains"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    void getCapitalGainsReport_invalidFinancialYear_returns400() throws Exception {
        when(capitalGainsReportGenerator.generate("2024-27"))
                .thenThrow(new InvalidArgumentException("financialYear", "Financial year must span consecutive years"));

        mockMvc.perform(get("/api/reports/capital-gains").param("financialYear", "2024-27"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.error.details.field").value("financialYear"));
    }
}
