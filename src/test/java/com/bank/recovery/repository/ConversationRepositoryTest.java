package com.bank.recovery.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.exception.ConversationCommitException;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.PaymentFrequency;
import com.bank.recovery.model.PaymentPlan;
import com.bank.recovery.model.PlanBuildResult;
import com.bank.recovery.model.PlanProposal;
import com.bank.recovery.plan.PaymentPlanBuilder;
import com.bank.recovery.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationRepositoryTest {

    @Mock
    private AerospikeClient client;

    private ConversationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ConversationRepository(client, "test", new WritePolicy(), new Policy(),
                Jackson2ObjectMapperBuilder.json().build());
    }

    private WritePolicy capturedPolicy() {
        ArgumentCaptor<WritePolicy> captor = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(captor.capture(), any(Key.class), any(Bin[].class));
        return captor.getValue();
    }

    @Test
    void commit_newConversation_createOnly() {
        Conversation conversation = TestDataFactory.createConversation("CONV-1", "D-1", "ACC-1",
                ConversationState.INITIATED);
        conversation.setGeneration(-1);

        repository.commit(conversation);

        WritePolicy policy = capturedPolicy();
        assertThat(policy.recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);
        assertThat(policy.generationPolicy).isEqualTo(GenerationPolicy.NONE);
        assertThat(conversation.getGeneration()).isEqualTo(1);
    }

    @Test
    void commit_storedConversation_checksGeneration() {
        Conversation conversation = TestDataFactory.createConversation("CONV-1", "D-1", "ACC-1",
                ConversationState.ACTIVE_NEGOTIATION);
        conversation.setGeneration(4);

        repository.commit(conversation);

        WritePolicy policy = capturedPolicy();
        assertThat(policy.generationPolicy).isEqualTo(GenerationPolicy.EXPECT_GEN_EQUAL);
        assertThat(policy.generation).isEqualTo(4);
        assertThat(policy.recordExistsAction).isEqualTo(RecordExistsAction.REPLACE_ONLY);
        assertThat(conversation.getGeneration()).isEqualTo(5);
    }

    @Test
    void commit_generationMismatch_isConcurrentModification() {
        Conversation conversation = TestDataFactory.createConversation("CONV-1", "D-1", "ACC-1",
                ConversationState.ACTIVE_NEGOTIATION);
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.commit(conversation))
                .isInstanceOf(ConversationCommitException.class)
                .satisfies(e -> assertThat(((ConversationCommitException) e).isConcurrentModification()).isTrue());
        assertThat(conversation.getGeneration()).isEqualTo(1);
    }

    @Test
    void commit_storeUnavailable_isNotAConflict() {
        Conversation conversation = TestDataFactory.createConversation("CONV-1", "D-1", "ACC-1",
                ConversationState.ACTIVE_NEGOTIATION);
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.commit(conversation))
                .isInstanceOf(ConversationCommitException.class)
                .satisfies(e -> assertThat(((ConversationCommitException) e).isConcurrentModification()).isFalse());
    }

    @Test
    void commit_writesPlanDueDatesAsIsoDates() {
        Conversation conversation = TestDataFactory.createVerifiedConversation("CONV-1", "D-1", "ACC-1");
        PaymentPlan plan = ((PlanBuildResult.Built) new PaymentPlanBuilder(PolicyProperties.defaults(),
                TestDataFactory.fixedClock()).build(1200,
                PlanProposal.installment(200, 2, LocalDate.of(2025, 11, 10), PaymentFrequency.MONTHLY))).plan();
        conversation.getPaymentPlans().add(plan);

        repository.commit(conversation);

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), any(Key.class), bins.capture());
        String plans = Arrays.stream(bins.getValue())
                .filter(b -> b.name.equals("plans"))
                .map(b -> b.value.toString())
                .findFirst()
                .orElseThrow();
        assertThat(plans).contains("\"2025-11-10\"", "\"2025-12-10\"");
    }
}
