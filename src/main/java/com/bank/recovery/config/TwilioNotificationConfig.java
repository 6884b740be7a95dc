package com.bank.recovery.config;

import com.bank.recovery.model.EscalationPriority;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Twilio credentials plus routing of escalation notices to the human-agent desk.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"

    private Desk desk = new Desk();

    @Data
    public static class Desk {
        // Fallback for priorities without a dedicated number
        private String number;
        private Map<EscalationPriority, String> priorityNumbers = new EnumMap<>(EscalationPriority.class);
        // Escalations below this priority are left to the desk's queue, no notice is sent
        private EscalationPriority minimumPriority = EscalationPriority.NORMAL;
        private String messagePrefix = "[ESCALATION]";
    }

    public boolean shouldNotify(EscalationPriority priority) {
        return enabled && priority.compareTo(desk.getMinimumPriority()) >= 0;
    }

    /**
     * Desk number for the priority, addressed for the configured channel. Null when neither a
     * dedicated nor a fallback number is configured.
     */
    public String deskAddressFor(EscalationPriority priority) {
        String number = desk.getPriorityNumbers().get(priority);
        if (number == null || number.isBlank()) {
            number = desk.getNumber();
        }
        if (number == null || number.isBlank()) {
            return null;
        }
        return address(number);
    }

    public String senderAddress() {
        return address(fromNumber);
    }

    private String address(String number) {
        if ("whatsapp".equalsIgnoreCase(channel)) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
