package com.bank.recovery.model;

/**
 * Identity facts claimed by the debtor. A null fact was not supplied and is not checked.
 *
 * @param identifierLastFour trailing digits of the national identifier
 * @param lastPaymentAmount  last payment amount as typed by the debtor, e.g. "150.00"
 */
public record ClaimedIdentity(String identifierLastFour, String lastPaymentAmount) {

    public boolean isEmpty() {
        return isBlank(identifierLastFour) && isBlank(lastPaymentAmount);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
