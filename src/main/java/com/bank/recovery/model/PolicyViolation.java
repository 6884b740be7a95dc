package com.bank.recovery.model;

/**
 * A payment-policy or message-content rule that a proposal breaks.
 *
 * @param code   stable machine name, e.g. "settlement_percentage"
 * @param detail human-readable explanation
 */
public record PolicyViolation(String code, String detail) {

    public static final String SETTLEMENT_PERCENTAGE = "settlement_percentage";
    public static final String INSTALLMENT_DURATION = "installment_duration";
    public static final String INSTALLMENT_COUNT = "installment_count";
    public static final String MINIMUM_PAYMENT = "minimum_payment";
    public static final String NON_POSITIVE_AMOUNT = "non_positive_amount";
    public static final String INVALID_AMOUNT = "invalid_amount";
    public static final String PROHIBITED_LANGUAGE = "prohibited_language";
    public static final String IDENTITY_VERIFICATION = "identity_verification";
}
