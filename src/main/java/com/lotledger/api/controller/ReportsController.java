package com.lotledger.api.controller;

import com.lotledger.reporting.CapitalGainsReport;
import com.lotledger.reporting.CapitalGainsReportGenerator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for capital gains reporting.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/reports/capital-gains?financialYear=2024-25} -- SHORT / LONG gains and tax
 *       estimate of an Indian financial year</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class ReportsController {

    private final CapitalGainsReportGenerator capitalGainsReportGenerator;

    public ReportsController(CapitalGainsReportGenerator capitalGainsReportGenerator) {
        this.capitalGainsReportGenerator = capitalGainsReportGenerator;
    }

    @GetMapping("/reports/capital-gains")
    public CapitalGainsReport getCapitalGainsReport(@RequestParam String financialYear) {
        return capitalGainsReportGenerator.generate(financialYear);
    }
}
