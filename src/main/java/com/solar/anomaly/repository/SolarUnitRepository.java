package com.solar.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.solar.anomaly.config.AerospikeConfig;
import com.solar.anomaly.model.SolarUnit;
import com.solar.anomaly.model.SolarUnitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Device directory. Units are owned by the account side of the platform; this
 * service only reads them (the seeder is the one writer).
 */
@Repository
public class SolarUnitRepository {

    private static final Logger log = LoggerFactory.getLogger(SolarUnitRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public SolarUnitRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(SolarUnit unit) {
        Key key = new Key(namespace, AerospikeConfig.SET_SOLAR_UNITS, unit.getUnitId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("unitId", unit.getUnitId()),
                new Bin("capacityW", unit.getCapacityWatts()),
                new Bin("status", unit.getStatus().name())));

        if (unit.getSerialNumber() != null) {
            bins.add(new Bin("serialNumber", unit.getSerialNumber()));
        }
        if (unit.getInstallationDate() != null) {
            bins.add(new Bin("installedOn", unit.getInstallationDate().toString()));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public SolarUnit findById(String unitId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SOLAR_UNITS, unitId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * All units with status ACTIVE, ordered by id.
     */
    public List<SolarUnit> findActive() {
        List<SolarUnit> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SOLAR_UNITS,
                (key, record) -> {
                    if (!SolarUnitStatus.ACTIVE.name().equals(record.getString("status"))) return;
                    try {
                        SolarUnit unit = mapRecord(record);
                        synchronized (results) {
                            results.add(unit);
                        }
                    } catch (Exception e) {
                        log.warn("Skipping unreadable solar unit record {}: {}", key.userKey, e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(SolarUnit::getUnitId));
        return results;
    }

    private SolarUnit mapRecord(Record record) {
        String installedOn = record.getString("installedOn");
        return SolarUnit.builder()
                .unitId(record.getString("unitId"))
                .serialNumber(record.getString("serialNumber"))
                .capacityWatts(record.getDouble("capacityW"))
                .status(SolarUnitStatus.valueOf(record.getString("status")))
                .installationDate(installedOn != null ? LocalDate.parse(installedOn) : null)
                .build();
    }
}
