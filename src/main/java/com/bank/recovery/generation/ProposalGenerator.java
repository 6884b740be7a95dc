package com.bank.recovery.generation;

/**
 * External capability that proposes the next negotiation action for a turn.
 *
 * Implementations may block. They report expected failures as {@link GenerationResult.Failed};
 * anything thrown is treated the same way by the caller.
 */
public interface ProposalGenerator {

    GenerationResult generate(GenerationRequest request);
}
