package com.bank.recovery.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.recovery.config.AerospikeConfig;
import com.bank.recovery.model.Account;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class AccountRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AccountRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public Account findById(String accountId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ACCOUNTS, accountId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public void save(Account account) {
        Key key = new Key(namespace, AerospikeConfig.SET_ACCOUNTS, account.getAccountId());

        client.put(writePolicy, key,
                new Bin("accountId", account.getAccountId()),
                new Bin("debtorId", account.getDebtorId()),
                new Bin("accountNumber", account.getAccountNumber()),
                new Bin("principal", account.getPrincipalAmount()),
                new Bin("balance", account.getCurrentBalance()),
                new Bin("currency", account.getCurrency()),
                new Bin("daysOverdue", account.getDaysOverdue()),
                new Bin("lastPaymentAt", account.getLastPaymentAt()),
                new Bin("lastPaymentAmt", account.getLastPaymentAmount()));
    }

    private Account mapRecord(Record record) {
        return Account.builder()
                .accountId(record.getString("accountId"))
                .debtorId(record.getString("debtorId"))
                .accountNumber(record.getString("accountNumber"))
                .principalAmount(record.getDouble("principal"))
                .currentBalance(record.getDouble("balance"))
                .currency(record.getString("currency"))
                .daysOverdue(record.getInt("daysOverdue"))
                .lastPaymentAt(record.getLong("lastPaymentAt"))
                .lastPaymentAmount(record.getDouble("lastPaymentAmt"))
                .build();
    }
}
