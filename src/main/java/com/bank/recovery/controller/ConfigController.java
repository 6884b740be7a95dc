package com.bank.recovery.controller;

import com.bank.recovery.config.PolicyProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the active negotiation and contact policy")
public class ConfigController {

    private final PolicyProperties policy;

    public ConfigController(PolicyProperties policy) {
        this.policy = policy;
    }

    @Operation(summary = "Get the active policy",
            description = "Settlement, installment, contact window, contact frequency and verification limits. " +
                    "Read-only; set through recovery.policy.* configuration.")
    @GetMapping("/policy")
    public ResponseEntity<PolicyProperties> getPolicy() {
        return ResponseEntity.ok(policy);
    }
}
