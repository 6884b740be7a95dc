package com.bank.recovery.contract;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.policy.Policy;
import com.bank.recovery.config.TestAerospikeConfig;
import com.bank.recovery.repository.ConversationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

/**
 * Checks that repositories are wired against the test namespace and the Boot-configured
 * Jackson mapper.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class RepositoryWiringTest {

    @Autowired
    private AerospikeClient client;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void conversationLookup_usesTestNamespaceAndMisses() {
        assertThat(conversationRepository.findById("CONV-MISSING")).isNull();

        verify(client, atLeastOnce()).get(any(Policy.class),
                argThat((Key key) -> TestAerospikeConfig.NAMESPACE.equals(key.namespace)
                        && "CONV-MISSING".equals(key.userKey.toString())));
    }

    @Test
    void bootMapper_writesDatesAsIsoStrings() throws Exception {
        assertThat(objectMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)).isFalse();
        assertThat(objectMapper.writeValueAsString(LocalDate.of(2025, 11, 10))).isEqualTo("\"2025-11-10\"");
    }
}
