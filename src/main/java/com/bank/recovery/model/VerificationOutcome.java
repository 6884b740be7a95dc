package com.bank.recovery.model;

public sealed interface VerificationOutcome {

    int attemptsRemaining();

    record Verified(int attemptsRemaining) implements VerificationOutcome {
    }

    record Failed(int attemptsRemaining) implements VerificationOutcome {
    }

    /** Attempt limit reached; no further identity checks on this conversation. */
    record Locked() implements VerificationOutcome {
        @Override
        public int attemptsRemaining() {
            return 0;
        }
    }
}
