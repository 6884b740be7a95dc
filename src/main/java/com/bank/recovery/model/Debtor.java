package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A debtor as held by the system of record")
public class Debtor {

    @Schema(description = "Debtor identifier", example = "DEBTOR-001")
    private String debtorId;

    @Schema(description = "Full name", example = "Jordan Avery")
    private String name;

    private String email;

    private String phone;

    // Trailing digits of the national identifier; the full value is never stored
    @Schema(hidden = true)
    private String identifierLastFour;

    @Builder.Default
    private ConsentStatus consentStatus = ConsentStatus.PENDING;

    private long consentAt;

    @Schema(description = "Opt-out timestamp in epoch milliseconds, 0 if the debtor has not opted out", example = "0")
    private long optOutAt;

    // Debtor-specific contact window ("HH:mm"); the policy window applies when either is absent
    private String contactHoursStart;
    private String contactHoursEnd;

    @Schema(description = "IANA zone the contact window is evaluated in", example = "America/New_York")
    private String timezone;

    @Builder.Default
    private Channel preferredChannel = Channel.EMAIL;

    public boolean isOptedOut() {
        return optOutAt > 0;
    }
}
