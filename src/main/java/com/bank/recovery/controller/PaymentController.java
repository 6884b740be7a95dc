package com.bank.recovery.controller;

import com.bank.recovery.model.PaymentReceipt;
import com.bank.recovery.model.PaymentRequest;
import com.bank.recovery.service.PaymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/payments")
@Tag(name = "Payments", description = "Record payments received against an account")
public class PaymentController {

    private final PaymentService paymentService;

    public PaymentController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @Operation(summary = "Record a payment",
            description = "Reduces the account balance and marks the earliest pending installment of an " +
                    "accepted plan as paid. No money is moved.")
    @PostMapping
    public ResponseEntity<PaymentReceipt> recordPayment(@Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.ok(paymentService.recordPayment(request));
    }
}
