package com.bank.recovery.model;

import java.util.Map;

/**
 * One inbound debtor message.
 *
 * @param sessionId conversation id; a new conversation is opened when no conversation has this id
 */
public record InboundMessage(String accountId, String sessionId, String text, Channel channel,
                             Map<String, String> metadata) {

    public InboundMessage {
        if (channel == null) channel = Channel.CHAT;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
