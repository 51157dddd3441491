package com.agentledger.api.controller;

import com.agentledger.domain.model.DiaryRecord;
import com.agentledger.domain.model.ReconciliationResult;
import com.agentledger.reconciliation.AgentReconciliationService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only endpoints over one account's reconciled state.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/accounts/{accountKey}/reconciliation -- positions, trades, orders, stats and feed</li>
 *   <li>GET /api/accounts/{accountKey}/diary -- newest diary records, oldest first</li>
 * </ul>
 *
 * <p>{@code limit} constraints are enforced by Spring MVC method validation and
 * surface as {@code VALIDATION_ERROR}.
 */
@RestController
@RequestMapping("/api/accounts/{accountKey}")
public class AccountLedgerController {

    static final int MAX_LIMIT = 1000;

    private final AgentReconciliationService agentReconciliationService;

    public AccountLedgerController(AgentReconciliationService agentReconciliationService) {
        this.agentReconciliationService = agentReconciliationService;
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationResult> reconcile(
            @PathVariable String accountKey,
            @RequestParam(defaultValue = "50") @Min(1) @Max(MAX_LIMIT) int limit) {
        return ResponseEntity.ok(agentReconciliationService.reconcile(accountKey, limit));
    }

    @GetMapping("/diary")
    public ResponseEntity<List<DiaryRecord>> diary(
            @PathVariable String accountKey,
            @RequestParam(defaultValue = "200") @Min(1) @Max(MAX_LIMIT) int limit) {
        return ResponseEntity.ok(agentReconciliationService.recentDiary(accountKey, limit));
    }
}
