package com.lotledger.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.lotledger.api.controller.InstrumentController;
import com.lotledger.domain.enums.LotAgeBucket;
import com.lotledger.domain.model.AgeBucketSummary;
import com.lotledger.domain.model.AgedLot;
import com.lotledger.domain.model.Holding;
import com.lotledger.domain.model.Lot;
import com.lotledger.domain.model.LotAgeDistribution;
import com.lotledger.exception.GlobalExceptionHandler;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.exception.ResourceNotFoundException;
import com.lotledger.ledger.LotLedger;
import com.lotledger.service.TransactionService;
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

class InstrumentControllerTest {

    private MockMvc mockMvc;

    @Mock
    private LotLedger lotLedger;

    @Mock
    private TransactionService transactionService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        InstrumentController controller = new InstrumentController(lotLedger, transactionService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(
                        Jackson2ObjectMapperBuilder.json()
                                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                .build()))
                .build();
    }

    @Test
    void getInstruments_returnsDistinctIds() throws Exception {
        when(transactionService.getInstrumentIds()).thenReturn(List.of("INFY", "TCS"));

        mockMvc.perform(get("/api/instruments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("INFY"))
                .andExpect(jsonPath("$[1]").value("TCS"));
    }

    @Test
    void getAvailableLots_returnsLotsInFifoOrder() throws Exception {
        when(lotLedger.availableLots("INFY"))
                .thenReturn(List.of(
                        Lot.builder()
                                .acquisitionId(1L)
                                .date(LocalDate.of(2024, 1, 1))
                                .unitPrice(new BigDecimal("100"))
                                .quantity(new BigDecimal("10"))
                                .available(new BigDecimal("4"))
                                .build(),
                        Lot.builder()
                                .acquisitionId(2L)
                                .date(LocalDate.of(2024, 2, 1))
                                .unitPrice(new BigDecimal("120"))
                                .quantity(new BigDecimal("5"))
                                .available(new BigDecimal("5"))
                                .build()));

        mockMvc.perform(get("/api/instruments/INFY/lots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].acquisitionId").value(1))
                .andExpect(jsonPath("$[0].available").value(4))
                .andExpect(jsonPath("$[1].date").value("2024-02-01"));
    }

    @Test
    void getAvailableLots_unknownInstrument_returns404() throws Exception {
        when(lotLedger.availableLots("XYZ")).thenThrow(new ResourceNotFoundException("Instrument", "XYZ"));

        mockMvc.perform(get("/api/instruments/XYZ/lots"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void getHolding_withoutMarketPrice_usesCostOnlyView() throws Exception {
        when(lotLedger.holding("INFY"))
                .thenReturn(Holding.builder()
                        .instrumentId("INFY")
                        .quantity(new BigDecimal("9"))
                        .costBasis(new BigDecimal("1000"))
                        .openLots(2)
                        .build());

        mockMvc.perform(get("/api/instruments/INFY/holding"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantity").value(9))
                .andExpect(jsonPath("$.openLots").value(2));

        verify(lotLedger, never()).unrealizedGain(any(), any());
    }

    @Test
    void getHolding_withMarketPrice_valuesPosition() throws Exception {
        when(lotLedger.unrealizedGain("INFY", new BigDecimal("150")))
                .thenReturn(Holding.builder()
                        .instrumentId("INFY")
                        .quantity(new BigDecimal("9"))
                        .costBasis(new BigDecimal("1000"))
                        .marketPrice(new BigDecimal("150"))
                        .marketValue(new BigDecimal("1350"))
                        .unrealizedGain(new BigDecimal("350"))
                        .build());

        mockMvc.perform(get("/api/instruments/INFY/holding").param("marketPrice", "150"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unrealizedGain").value(350));
    }

    @Test
    void getHolding_nonPositiveMarketPrice_returns400() throws Exception {
        when(lotLedger.unrealizedGain("INFY", BigDecimal.ZERO))
                .thenThrow(new InvalidArgumentException("marketPrice", "marketPrice must be positive"));

        mockMvc.perform(get("/api/instruments/INFY/holding").param("marketPrice", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void getHolding_nonNumericMarketPrice_returns400() throws Exception {
        mockMvc.perform(get("/api/instruments/INFY/holding").param("marketPrice", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    void getAgeDistribution_usesRequestedDate() throws Exception {
        LocalDate asOf = LocalDate.of(2025, 1, 1);
        when(lotLedger.ageDistribution("INFY", asOf))
                .thenReturn(LotAgeDistribution.builder()
                        .instrumentId("INFY")
                        .asOf(asOf)
                        .totalQuantity(new BigDecimal("20"))
                        .instrumentCount(1)
                        .buckets(List.of(AgeBucketSummary.builder()
                                .bucket(LotAgeBucket.UNDER_6_MONTHS)
                                .label("0-6 months")
                                .quantity(new BigDecimal("5"))
                                .percentage(new BigDecimal("25.00"))
                                .build()))
                        .build());

        mockMvc.perform(get("/api/instruments/INFY/age-distribution").param("asOf", "2025-01-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalQuantity").value(20))
                .andExpect(jsonPath("$.buckets[0].bucket").value("UNDER_6_MONTHS"))
                .andExpect(jsonPath("$.buckets[0].label").value("0-6 months"))
                .andExpect(jsonPath("$.buckets[0].percentage").value(25.00));
    }

    @Test
    void getPortfolioAgeDistribution_defaultsToToday() throws Exception {
        when(lotLedger.ageDistribution(LocalDate.now()))
                .thenReturn(LotAgeDistribution.builder()
                        .totalQuantity(BigDecimal.ZERO)
                        .instrumentCount(0)
                        .buckets(List.of())
                        .build());

        mockMvc.perform(get("/api/instruments/age-distribution"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.instrumentCount").value(0));
    }

    @Test
    void getLotsInBucket_acceptsLabelOrName() throws Exception {
        LocalDate asOf = LocalDate.of(2025, 1, 1);
        when(lotLedger.lotsInBucket(eq("INFY"), eq(LotAgeBucket.ONE_TO_2_YEARS), eq(asOf), isNull()))
                .thenReturn(List.of(AgedLot.builder()
                        .acquisitionId(1L)
                        .instrumentId("INFY")
                        .acquisitionDate(LocalDate.of(2023, 6, 1))
                        .available(new BigDecimal("10"))
                        .ageDays(580)
                        .bucket(LotAgeBucket.ONE_TO_2_YEARS)
                        .build()));

        mockMvc.perform(get("/api/instruments/INFY/age-distribution/ONE_TO_2_YEARS").param("asOf", "2025-01-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].acquisitionId").value(1))
                .andExpect(jsonPath("$[0].ageDays").value(580));
        mockMvc.perform(get("/api/instruments/INFY/age-distribution/{bucket}", "1-2 years").param("asOf", "2025-01-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void getLotsInBucket_unknownBucket_returns400() throws Exception {
        mockMvc.perform(get("/api/instruments/INFY/age-distribution/ancient"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }
}
