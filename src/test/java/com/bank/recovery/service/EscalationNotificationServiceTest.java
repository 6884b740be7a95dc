package com.bank.recovery.service;

import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.config.TwilioNotificationConfig;
import com.bank.recovery.model.EscalationPriority;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationNotificationServiceTest {

    private SimpleMeterRegistry registry;
    private TwilioNotificationConfig config;
    private EscalationNotificationService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        config = new TwilioNotificationConfig();
        config.setEnabled(true);
        config.setFromNumber("+15550000000");
        service = new EscalationNotificationService(config, new MetricsConfig(registry));
    }

    @Test
    void deskAddress_prefersPriorityNumberAndFallsBackToDesk() {
        config.getDesk().setNumber("+15550001111");
        config.getDesk().getPriorityNumbers().put(EscalationPriority.URGENT, "+15550009999");
        config.getDesk().getPriorityNumbers().put(EscalationPriority.HIGH, "");

        assertThat(config.deskAddressFor(EscalationPriority.URGENT)).isEqualTo("+15550009999");
        assertThat(config.deskAddressFor(EscalationPriority.HIGH)).isEqualTo("+15550001111");
        assertThat(config.deskAddressFor(EscalationPriority.NORMAL)).isEqualTo("+15550001111");
    }

    @Test
    void whatsappChannel_prefixesBothAddresses() {
        config.setChannel("whatsapp");
        config.getDesk().setNumber("+15550001111");

        assertThat(config.deskAddressFor(EscalationPriority.HIGH)).isEqualTo("whatsapp:+15550001111");
        assertThat(config.senderAddress()).isEqualTo("whatsapp:+15550000000");
    }

    @Test
    void shouldNotify_respectsMinimumPriorityAndEnabledFlag() {
        config.getDesk().setMinimumPriority(EscalationPriority.HIGH);

        assertThat(config.shouldNotify(EscalationPriority.NORMAL)).isFalse();
        assertThat(config.shouldNotify(EscalationPriority.HIGH)).isTrue();
        assertThat(config.shouldNotify(EscalationPriority.URGENT)).isTrue();

        config.setEnabled(false);
        assertThat(config.shouldNotify(EscalationPriority.URGENT)).isFalse();
    }

    @Test
    void notifyEscalation_belowMinimumPriority_sendsNothing() {
        config.getDesk().setNumber("+15550001111");

        service.notifyEscalation("CONV-1", "ACC-1", "debtor asked", EscalationPriority.LOW);

        assertThat(registry.find("notification.sent.count").counters()).isEmpty();
    }

    @Test
    void notifyEscalation_withoutDeskNumber_isCountedAndSkipped() {
        service.notifyEscalation("CONV-1", "ACC-1", "verification_lockout", EscalationPriority.HIGH);

        assertThat(registry.get("notification.sent.count").tag("status", "no_desk").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void composeNotice_usesConfiguredPrefixAndResponseTime() {
        config.getDesk().setMessagePrefix("[RECOVERY DESK]");

        String notice = service.composeNotice("CONV-1", "ACC-1", "verification_lockout", EscalationPriority.HIGH);

        assertThat(notice).startsWith("[RECOVERY DESK] Conversation needs a human agent")
                .contains("Conversation: CONV-1", "Account: ACC-1",
                        "Priority: HIGH (respond within 2-4 hours)", "Reason: verification_lockout");
    }
}
