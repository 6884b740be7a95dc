package com.bank.recovery.generation;

import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.model.*;
import com.bank.recovery.plan.PaymentPlanBuilder;
import com.bank.recovery.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptedProposalGeneratorTest {

    private final PolicyProperties policy = PolicyProperties.defaults();
    private final ScriptedProposalGenerator generator = new ScriptedProposalGenerator(policy);

    private ProposedAction generate(String text, boolean verified, double balance) {
        GenerationResult result = generator.generate(new GenerationRequest(text,
                TestDataFactory.createContext("CONV-1", verified, balance), List.of()));
        assertThat(result).isInstanceOf(GenerationResult.Generated.class);
        return ((GenerationResult.Generated) result).proposal();
    }

    @Test
    void unverifiedDebtor_isAskedToVerify() {
        ProposedAction proposal = generate("what is my balance", false, 1200);

        assertThat(proposal.type()).isEqualTo(ActionType.VERIFY_IDENTITY);
    }

    @Test
    void attorneyMention_escalatesBeforeVerification() {
        ProposedAction proposal = generate("My attorney will call you", false, 1200);

        assertThat(proposal.type()).isEqualTo(ActionType.ESCALATE);
        assertThat(proposal.escalation()).isTrue();
    }

    @Test
    void settlementOffer_staysWithinPolicy() {
        ProposedAction proposal = generate("Can I settle this?", true, 1234.57);
        PaymentPlanBuilder builder = new PaymentPlanBuilder(policy, TestDataFactory.fixedClock());

        assertThat(proposal.type()).isEqualTo(ActionType.PROPOSE_PLAN);
        assertThat(proposal.plan()).isPresent();
        assertThat(builder.validate(1234.57, proposal.plan().get())).isEmpty();
    }

    @Test
    void installmentOffer_respectsMinimumPayment() {
        ProposedAction proposal = generate("I need a payment plan", true, 100);
        PlanProposal plan = proposal.plan().orElseThrow();

        assertThat(plan.type()).isEqualTo(PlanType.INSTALLMENT);
        assertThat(plan.installments()).isEqualTo(4);
        assertThat(plan.amount()).isEqualTo(25.0);
    }

    @Test
    void payInFull_collectsWholeBalance() {
        ProposedAction proposal = generate("I want to pay it all", true, 300);

        assertThat(proposal.type()).isEqualTo(ActionType.COLLECT_PAYMENT);
        assertThat(proposal.plan().orElseThrow().amount()).isEqualTo(300.0);
    }

    @Test
    void goodbye_closes() {
        assertThat(generate("ok bye", true, 300).type()).isEqualTo(ActionType.CLOSE);
    }
}
