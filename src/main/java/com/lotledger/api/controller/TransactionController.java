package com.lotledger.api.controller;

import com.lotledger.api.dto.request.EditTransactionRequest;
import com.lotledger.api.dto.request.TransactionRequest;
import com.lotledger.domain.model.AuditEntry;
import com.lotledger.domain.model.DisposalResult;
import com.lotledger.domain.model.EditCommitResult;
import com.lotledger.domain.model.EditProposal;
import com.lotledger.domain.model.EditSummary;
import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.mapper.TransactionRequestMapper;
import com.lotledger.service.AuditService;
import com.lotledger.service.DisposalService;
import com.lotledger.service.EditService;
import com.lotledger.service.TransactionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for ledger transactions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/transactions/acquisitions} -- record an acquisition</li>
 *   <li>{@code POST /api/transactions/disposals} -- record a disposal and its FIFO matches</li>
 *   <li>{@code GET /api/transactions} -- list transactions, optionally by instrumentId</li>
 *   <li>{@code GET /api/transactions/{id}} -- get one transaction</li>
 *   <li>{@code GET /api/transactions/{id}/gains} -- realized gains of a disposal or drawn from an acquisition</li>
 *   <li>{@code DELETE /api/transactions/{id}} -- delete an unconsumed acquisition</li>
 *   <li>{@code POST /api/transactions/{id}/edits/validate} -- check an edit without applying it</li>
 *   <li>{@code PUT /api/transactions/{id}} -- apply an edit</li>
 *   <li>{@code GET /api/transactions/{id}/history} -- field-level edit history</li>
 *   <li>{@code GET /api/transactions/{id}/history/summary} -- condensed edit history</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/transactions")
public class TransactionController {

    private final TransactionService transactionService;
    private final DisposalService disposalService;
    private final EditService editService;
    private final AuditService auditService;
    private final TransactionRequestMapper transactionRequestMapper;

    public TransactionController(
            TransactionService transactionService,
            DisposalService disposalService,
            EditService editService,
            AuditService auditService,
            TransactionRequestMapper transactionRequestMapper) {
        this.transactionService = transactionService;
        this.disposalService = disposalService;
        this.editService = editService;
        this.auditService = auditService;
        this.transactionRequestMapper = transactionRequestMapper;
    }

    @PostMapping("/acquisitions")
    @ResponseStatus(HttpStatus.CREATED)
    public LedgerTransaction recordAcquisition(@RequestBody @Valid TransactionRequest request) {
        return transactionService.recordAcquisition(
                request.getInstrumentId(),
                request.getQuantity(),
                request.getUnitPrice(),
                request.getTransactionDate(),
                request.getCharges(),
                request.getNotes());
    }

    @PostMapping("/disposals")
    @ResponseStatus(HttpStatus.CREATED)
    public DisposalResult recordDisposal(@RequestBody @Valid TransactionRequest request) {
        return disposalService.recordDisposal(
                request.getInstrumentId(),
                request.getQuantity(),
                request.getUnitPrice(),
                request.getTransactionDate(),
                request.getCharges(),
                request.getNotes());
    }

    @GetMapping
    public List<LedgerTransaction> getTransactions(@RequestParam(required = false) String instrumentId) {
        return transactionService.getTransactions(instrumentId);
    }

    @GetMapping("/{id}")
    public LedgerTransaction getTransaction(@PathVariable Long id) {
        return transactionService.getTransaction(id);
    }

    @GetMapping("/{id}/gains")
    public List<RealizedGain> getRealizedGains(@PathVariable Long id) {
        return transactionService.getRealizedGains(id);
    }

    @DeleteMapping("/{id}")
    public Map<String, String> deleteTransaction(@PathVariable Long id) {
        transactionService.deleteAcquisition(id);
        return Map.of("message", "Transaction deleted");
    }

    @PostMapping("/{id}/edits/validate")
    public EditProposal validateEdit(@PathVariable Long id, @RequestBody @Valid EditTransactionRequest request) {
        return editService.proposeEdit(id, transactionRequestMapper.toEdit(request));
    }

    @PutMapping("/{id}")
    public EditCommitResult commitEdit(@PathVariable Long id, @RequestBody @Valid EditTransactionRequest request) {
        return editService.commitEdit(id, transactionRequestMapper.toEdit(request));
    }

    @GetMapping("/{id}/history")
    public List<AuditEntry> getHistory(@PathVariable Long id) {
        return auditService.getHistory(id);
    }

    @GetMapping("/{id}/history/summary")
    public EditSummary getEditSummary(@PathVariable Long id) {
        return auditService.getEditSummary(id);
    }
}
