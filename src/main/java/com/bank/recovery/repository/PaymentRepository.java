package com.bank.recovery.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.bank.recovery.config.AerospikeConfig;
import com.bank.recovery.model.PaymentRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class PaymentRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public PaymentRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(PaymentRecord payment) {
        Key key = new Key(namespace, AerospikeConfig.SET_PAYMENTS, payment.getTransactionId());

        // Transaction ids are unique; a second write with the same id is rejected
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        client.put(policy, key,
                new Bin("txnId", payment.getTransactionId()),
                new Bin("accountId", payment.getAccountId()),
                new Bin("convId", payment.getConversationId()),
                new Bin("amount", payment.getAmount()),
                new Bin("method", payment.getPaymentMethod()),
                new Bin("recordedAt", payment.getRecordedAt()),
                new Bin("planId", payment.getAllocatedPlanId()),
                new Bin("installment", payment.getAllocatedInstallment()));
    }

    public PaymentRecord findById(String transactionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PAYMENTS, transactionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return PaymentRecord.builder()
                .transactionId(record.getString("txnId"))
                .accountId(record.getString("accountId"))
                .conversationId(record.getString("convId"))
                .amount(record.getDouble("amount"))
                .paymentMethod(record.getString("method"))
                .recordedAt(record.getLong("recordedAt"))
                .allocatedPlanId(record.getString("planId"))
                .allocatedInstallment(record.getInt("installment"))
                .build();
    }
}
