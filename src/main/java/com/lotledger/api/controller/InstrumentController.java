package com.lotledger.api.controller;

import com.lotledger.domain.enums.LotAgeBucket;
import com.lotledger.domain.model.AgedLot;
import com.lotledger.domain.model.Holding;
import com.lotledger.domain.model.Lot;
import com.lotledger.domain.model.LotAgeDistribution;
import com.lotledger.ledger.LotLedger;
import com.lotledger.service.TransactionService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for per-instrument inventory.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/instruments} -- instruments with at least one transaction</li>
 *   <li>{@code GET /api/instruments/{instrumentId}/lots} -- open lots in FIFO order</li>
 *   <li>{@code GET /api/instruments/{instrumentId}/holding} -- open quantity and cost basis,
 *       valued when {@code marketPrice} is given</li>
 *   <li>{@code GET /api/instruments/age-distribution} -- open quantity by lot age across all instruments</li>
 *   <li>{@code GET /api/instruments/{instrumentId}/age-distribution} -- open quantity by lot age</li>
 *   <li>{@code GET /api/instruments/{instrumentId}/age-distribution/{bucket}} -- the open lots of one
 *       age bucket, by enum name or label</li>
 * </ul>
 * Ages are measured at {@code asOf} (ISO date, default today).
 */
@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {

    private final LotLedger lotLedger;
    private final TransactionService transactionService;

    public InstrumentController(LotLedger lotLedger, TransactionService transactionService) {
        this.lotLedger = lotLedger;
        this.transactionService = transactionService;
    }

    @GetMapping
    public List<String> getInstruments() {
        return transactionService.getInstrumentIds();
    }

    @GetMapping("/{instrumentId}/lots")
    public List<Lot> getAvailableLots(@PathVariable String instrumentId) {
        return lotLedger.availableLots(instrumentId);
    }

    @GetMapping("/{instrumentId}/holding")
    public Holding getHolding(
            @PathVariable String instrumentId, @RequestParam(required = false) BigDecimal marketPrice) {
        if (marketPrice != null) {
            return lotLedger.unrealizedGain(instrumentId, marketPrice);
        }
        return lotLedger.holding(instrumentId);
    }

    @GetMapping("/age-distribution")
    public LotAgeDistribution getPortfolioAgeDistribution(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return lotLedger.ageDistribution(asOfOrToday(asOf));
    }

    @GetMapping("/{instrumentId}/age-distribution")
    public LotAgeDistribution getAgeDistribution(
            @PathVariable String instrumentId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return lotLedger.ageDistribution(instrumentId, asOfOrToday(asOf));
    }

    @GetMapping("/{instrumentId}/age-distribution/{bucket}")
    public List<AgedLot> getLotsInBucket(
            @PathVariable String instrumentId,
            @PathVariable String bucket,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
            @RequestParam(required = false) BigDecimal marketPrice) {
        return lotLedger.lotsInBucket(instrumentId, LotAgeBucket.parse(bucket), asOfOrToday(asOf), marketPrice);
    }

    private static LocalDate asOfOrToday(LocalDate asOf) {
        return asOf != null ? asOf : LocalDate.now();
    }
}
