package com.bank.recovery.model;

public enum PlanType {
    SETTLEMENT,
    INSTALLMENT,
    ONE_TIME
}
