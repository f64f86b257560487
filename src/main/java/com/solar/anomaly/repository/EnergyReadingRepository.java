package com.solar.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.solar.anomaly.config.AerospikeConfig;
import com.solar.anomaly.model.EnergyReading;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reading store populated by the external sync process.
 */
@Repository
public class EnergyReadingRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public EnergyReadingRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(EnergyReading reading) {
        Key key = new Key(namespace, AerospikeConfig.SET_ENERGY_READINGS, reading.getReadingId());
        client.put(writePolicy, key,
                new Bin("readingId", reading.getReadingId()),
                new Bin("unitId", reading.getUnitId()),
                new Bin("timestamp", reading.getTimestamp()),
                new Bin("energy", reading.getEnergyGenerated()),
                new Bin("intervalHours", reading.getIntervalHours()));
    }

    /**
     * Readings of one unit with {@code fromInclusive <= timestamp < toExclusive},
     * oldest first.
     */
    public List<EnergyReading> findByUnitBetween(String unitId, long fromInclusive, long toExclusive) {
        List<EnergyReading> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ENERGY_READINGS,
                (key, record) -> {
                    if (!unitId.equals(record.getString("unitId"))) return;
                    long timestamp = record.getLong("timestamp");
                    if (timestamp < fromInclusive || timestamp >= toExclusive) return;

                    EnergyReading reading = EnergyReading.builder()
                            .readingId(record.getString("readingId"))
                            .unitId(unitId)
                            .timestamp(timestamp)
                            .energyGenerated(record.getDouble("energy"))
                            .intervalHours(record.getDouble("intervalHours"))
                            .build();
                    synchronized (results) {
                        results.add(reading);
                    }
                });

        results.sort(Comparator.comparingLong(EnergyReading::getTimestamp));
        return results;
    }
}
