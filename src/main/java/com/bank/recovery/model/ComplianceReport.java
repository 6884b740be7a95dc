package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Every recorded compliance outcome of a conversation")
public class ComplianceReport {

    private String conversationId;

    @Schema(description = "failed, warning or passed", example = "passed")
    private String overallStatus;

    @Builder.Default
    private List<ComplianceCheckResult> checks = new ArrayList<>();

    private int failedCount;
    private boolean requiresHumanReview;
    private long generatedAt;
}
