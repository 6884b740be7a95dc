package com.bank.recovery.generation;

import com.bank.recovery.model.ProposedAction;

/**
 * Outcome of one generator call: a proposal, or a typed failure that selects the fallback path.
 */
public sealed interface GenerationResult {

    enum FailureKind {
        ERROR,
        TIMEOUT,
        INVALID_OUTPUT
    }

    record Generated(ProposedAction proposal) implements GenerationResult {
    }

    record Failed(FailureKind kind, String detail) implements GenerationResult {
    }
}
