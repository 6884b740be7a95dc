package com.bank.recovery.model;

public enum ConsentStatus {
    PENDING,
    GRANTED,
    REVOKED,
    EXPIRED
}
