package com.bank.recovery.controller;

import com.bank.recovery.model.OptOutResult;
import com.bank.recovery.service.OptOutService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/debtors")
@Tag(name = "Debtors", description = "Debtor consent management")
public class DebtorController {

    private final OptOutService optOutService;

    public DebtorController(OptOutService optOutService) {
        this.optOutService = optOutService;
    }

    @Operation(summary = "Opt a debtor out of all contact",
            description = "Idempotent. Every open conversation of the debtor moves to OPTED_OUT.")
    @PostMapping("/{debtorId}/opt-out")
    public ResponseEntity<OptOutResult> optOut(
            @Parameter(description = "Debtor ID", example = "DEBTOR-001")
            @PathVariable String debtorId,
            @Parameter(description = "Conversation the request arrived on")
            @RequestParam(required = false) String conversationId) {
        return ResponseEntity.ok(optOutService.optOut(debtorId, conversationId));
    }
}
