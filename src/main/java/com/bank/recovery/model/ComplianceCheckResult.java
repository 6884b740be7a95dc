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
@Schema(description = "Outcome of a single compliance check")
public class ComplianceCheckResult {

    @Schema(description = "Check name", example = "daily_contact_frequency")
    private String checkName;

    @Schema(description = "Whether the check passed", example = "true")
    private boolean passed;

    @Schema(description = "Severity of a failure (INFO when passed)", example = "WARNING")
    @Builder.Default
    private Severity severity = Severity.INFO;

    @Schema(description = "Human-readable explanation", example = "Daily contact attempts: 1/3")
    private String details;

    public static ComplianceCheckResult passed(String checkName, String details) {
        return ComplianceCheckResult.builder()
                .checkName(checkName)
                .passed(true)
                .details(details)
                .build();
    }

    public static ComplianceCheckResult failed(String checkName, Severity severity, String details) {
        return ComplianceCheckResult.builder()
                .checkName(checkName)
                .passed(false)
                .severity(severity)
                .details(details)
                .build();
    }
}
