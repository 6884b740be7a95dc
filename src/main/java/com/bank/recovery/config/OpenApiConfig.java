package com.bank.recovery.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI debtRecoveryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Debt Recovery Negotiation API")
                        .version("1.0.0")
                        .description(
                                "Compliant negotiation of debt repayment with debtors.\n\n" +
                                "**Turn Pipeline:** (`POST /conversations/messages`)\n" +
                                "1. Opted-out conversations get a fixed reply, nothing else happens\n" +
                                "2. Contact compliance gate: opt-out, contact window, daily and weekly frequency\n" +
                                "3. Record the inbound message\n" +
                                "4. Ask the proposal generator for the next action\n" +
                                "5. Validate the proposal against payment policy and message-content rules; " +
                                "any violation forces an escalation to a human agent\n" +
                                "6. Apply the action (state transition, payment plan creation)\n" +
                                "7. Record the reply and commit the turn atomically\n\n" +
                                "**States:** `INITIATED`, `IDENTITY_VERIFICATION`, `ACTIVE_NEGOTIATION`, " +
                                "`PAYMENT_PROCESSING`, and the terminal `ESCALATED`, `CLOSED`, `OPTED_OUT`.\n\n" +
                                "**Seeded Debtors:** DEBTOR-001 to DEBTOR-003 (DEBTOR-003 has opted out)")
                        .contact(new Contact().name("Debt Recovery Team")));
    }
}
