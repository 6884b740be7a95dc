package com.bank.recovery.audit;

import java.util.regex.Pattern;

/**
 * Masks personal data before text reaches a log line or the audit trail.
 */
public final class PiiMasker {

    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern PHONE = Pattern.compile("(?:\\+?1[-. ]?)?\\(?\\b\\d{3}\\)?[-. ]\\d{3}[-. ]\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    // Bare digit runs long enough to be an identifier or account number
    private static final Pattern LONG_DIGITS = Pattern.compile("\\b\\d{9,19}\\b");

    private PiiMasker() {}

    public static String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String masked = SSN.matcher(text).replaceAll("XXX-XX-XXXX");
        masked = EMAIL.matcher(masked).replaceAll("XXX@XXX.com");
        masked = PHONE.matcher(masked).replaceAll("XXX-XXX-XXXX");
        return LONG_DIGITS.matcher(masked).replaceAll("#########");
    }

    /**
     * Masks a claimed identity fact completely, keeping only whether one was given.
     */
    public static String maskFact(String fact) {
        return fact == null || fact.isBlank() ? "<none>" : "****";
    }
}
