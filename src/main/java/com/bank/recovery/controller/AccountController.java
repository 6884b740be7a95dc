package com.bank.recovery.controller;

import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.DebtValidationResult;
import com.bank.recovery.service.ConversationQueryService;
import com.bank.recovery.service.DebtValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/accounts")
@Tag(name = "Accounts", description = "Debt validation requests and account conversation history")
public class AccountController {

    private final DebtValidationService debtValidationService;
    private final ConversationQueryService queryService;

    public AccountController(DebtValidationService debtValidationService,
                             ConversationQueryService queryService) {
        this.debtValidationService = debtValidationService;
        this.queryService = queryService;
    }

    @Operation(summary = "Request debt validation",
            description = "Pauses collection: conversations in active negotiation are escalated to a human agent.")
    @PostMapping("/{accountId}/debt-validation")
    public ResponseEntity<DebtValidationResult> requestValidation(
            @Parameter(description = "Account ID", example = "ACC-1001")
            @PathVariable String accountId,
            @RequestParam(required = false) String conversationId) {
        return ResponseEntity.ok(debtValidationService.requestValidation(accountId, conversationId));
    }

    @Operation(summary = "List conversations of an account", description = "Oldest first.")
    @GetMapping("/{accountId}/conversations")
    public ResponseEntity<List<Conversation>> getConversations(@PathVariable String accountId) {
        return ResponseEntity.ok(queryService.getAccountConversations(accountId));
    }
}
