package com.bank.recovery.contract;

import com.bank.recovery.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so that endpoint paths and response
 * schemas do not drift unnoticed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = apiDocs();
        Map<String, Object> paths = json.read("$.paths");

        // Conversation endpoints
        assertThat(paths).containsKey("/api/v1/conversations/messages");
        assertThat(paths).containsKey("/api/v1/conversations/{conversationId}");
        assertThat(paths).containsKey("/api/v1/conversations/{conversationId}/verify-identity");
        assertThat(paths).containsKey("/api/v1/conversations/{conversationId}/escalate");
        assertThat(paths).containsKey("/api/v1/conversations/{conversationId}/plans/{planId}/accept");
        assertThat(paths).containsKey("/api/v1/conversations/{conversationId}/compliance-report");

        // Debtor and account endpoints
        assertThat(paths).containsKey("/api/v1/debtors/{debtorId}/opt-out");
        assertThat(paths).containsKey("/api/v1/accounts/{accountId}/debt-validation");
        assertThat(paths).containsKey("/api/v1/accounts/{accountId}/conversations");

        assertThat(paths).containsKey("/api/v1/payments");
        assertThat(paths).containsKey("/api/v1/config/policy");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("MessageRequest");
        assertThat(schemas).containsKey("TurnResponse");
        assertThat(schemas).containsKey("VerificationResponse");
        assertThat(schemas).containsKey("EscalationResult");
        assertThat(schemas).containsKey("PaymentPlan");
        assertThat(schemas).containsKey("PaymentReceipt");
        assertThat(schemas).containsKey("ComplianceReport");
        assertThat(schemas).containsKey("PolicyProperties");
    }

    @Test
    void openApiSpec_turnAndPlanSchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> turnProps = json.read("$.components.schemas.TurnResponse.properties");
        assertThat(turnProps).containsKeys("conversationId", "outcome", "state", "message", "action",
                "confidence", "complianceTags");

        Map<String, Object> planProps = json.read("$.components.schemas.PaymentPlan.properties");
        assertThat(planProps).containsKeys("planId", "planType", "totalAmount", "installmentAmount",
                "installmentCount", "firstDueDate", "frequency", "status", "scheduledPayments");

        Map<String, Object> reportProps = json.read("$.components.schemas.ComplianceReport.properties");
        assertThat(reportProps).containsKeys("overallStatus", "checks", "requiresHumanReview");
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
