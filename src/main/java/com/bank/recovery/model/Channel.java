package com.bank.recovery.model;

public enum Channel {
    CHAT,
    SMS,
    EMAIL,
    VOICE
}
