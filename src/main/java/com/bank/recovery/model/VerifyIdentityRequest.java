package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Identity facts claimed by the debtor; at least one is required")
public record VerifyIdentityRequest(
        @Schema(example = "1234") String lastFourSsn,
        @Schema(example = "150.00") String lastPaymentAmount) {

    public ClaimedIdentity toClaimedIdentity() {
        return new ClaimedIdentity(lastFourSsn, lastPaymentAmount);
    }
}
