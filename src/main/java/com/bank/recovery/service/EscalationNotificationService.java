package com.bank.recovery.service;

import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.config.TwilioNotificationConfig;
import com.bank.recovery.model.EscalationPriority;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Tells the human-agent desk that a conversation needs them. Best effort: failures are
 * logged and counted, never propagated.
 */
@Service
public class EscalationNotificationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public EscalationNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Escalation notifications initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Escalation notifications are DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.escalation", contextualName = "send-escalation-notice")
    public void notifyEscalation(String conversationId, String accountId, String reason, EscalationPriority priority) {
        if (!config.shouldNotify(priority)) {
            return;
        }
        String deskAddress = config.deskAddressFor(priority);
        if (deskAddress == null) {
            metricsConfig.recordNotification(config.getChannel(), "no_desk");
            log.warn("No desk number configured for {} escalation of conversation={}", priority, conversationId);
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(deskAddress),
                    new PhoneNumber(config.senderAddress()),
                    composeNotice(conversationId, accountId, reason, priority)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Escalation notice sent for conversation={}, sid={}", conversationId, message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send escalation notice for conversation={}: {}", conversationId, e.getMessage(), e);
        }
    }

    String composeNotice(String conversationId, String accountId, String reason, EscalationPriority priority) {
        return String.format(
                "%s Conversation needs a human agent\n" +
                "Conversation: %s\n" +
                "Account: %s\n" +
                "Priority: %s (respond within %s)\n" +
                "Reason: %s",
                config.getDesk().getMessagePrefix(), conversationId, accountId, priority,
                priority.estimatedResponseTime(), reason);
    }
}
