package com.bank.recovery.model;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
