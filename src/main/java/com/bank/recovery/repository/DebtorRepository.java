package com.bank.recovery.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.recovery.config.AerospikeConfig;
import com.bank.recovery.model.Channel;
import com.bank.recovery.model.ConsentStatus;
import com.bank.recovery.model.Debtor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class DebtorRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public DebtorRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public Debtor findById(String debtorId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEBTORS, debtorId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public void save(Debtor debtor) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEBTORS, debtor.getDebtorId());

        client.put(writePolicy, key,
                new Bin("debtorId", debtor.getDebtorId()),
                new Bin("name", debtor.getName()),
                new Bin("email", debtor.getEmail()),
                new Bin("phone", debtor.getPhone()),
                new Bin("idLastFour", debtor.getIdentifierLastFour()),
                new Bin("consent", debtor.getConsentStatus().name()),
                new Bin("consentAt", debtor.getConsentAt()),
                new Bin("optOutAt", debtor.getOptOutAt()),
                new Bin("hoursStart", debtor.getContactHoursStart()),
                new Bin("hoursEnd", debtor.getContactHoursEnd()),
                new Bin("timezone", debtor.getTimezone()),
                new Bin("prefChannel", debtor.getPreferredChannel().name()));
    }

    /**
     * Sets the opt-out timestamp with a single-bin write so concurrent profile saves
     * cannot clear it.
     */
    public void markOptedOut(String debtorId, long optOutAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEBTORS, debtorId);
        client.put(writePolicy, key, new Bin("optOutAt", optOutAt));
    }

    private Debtor mapRecord(Record record) {
        String consent = record.getString("consent");
        String channel = record.getString("prefChannel");
        return Debtor.builder()
                .debtorId(record.getString("debtorId"))
                .name(record.getString("name"))
                .email(record.getString("email"))
                .phone(record.getString("phone"))
                .identifierLastFour(record.getString("idLastFour"))
                .consentStatus(consent != null ? ConsentStatus.valueOf(consent) : ConsentStatus.PENDING)
                .consentAt(record.getLong("consentAt"))
                .optOutAt(record.getLong("optOutAt"))
                .contactHoursStart(record.getString("hoursStart"))
                .contactHoursEnd(record.getString("hoursEnd"))
                .timezone(record.getString("timezone"))
                .preferredChannel(channel != null ? Channel.valueOf(channel) : Channel.EMAIL)
                .build();
    }
}
