package com.bank.recovery.model;

/**
 * Contact compliance checks in evaluation order.
 */
public enum ContactCheck {
    OPT_OUT("opt_out_status"),
    CONTACT_WINDOW("contact_time"),
    DAILY_FREQUENCY("daily_contact_frequency"),
    WEEKLY_FREQUENCY("weekly_contact_frequency");

    private final String checkName;

    ContactCheck(String checkName) {
        this.checkName = checkName;
    }

    public String checkName() {
        return checkName;
    }
}
