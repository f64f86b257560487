package com.solar.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solar.anomaly.config.AerospikeConfig;
import com.solar.anomaly.model.AffectedPeriod;
import com.solar.anomaly.model.Anomaly;
import com.solar.anomaly.model.AnomalyFilter;
import com.solar.anomaly.model.AnomalyStatus;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.DetectionDetails;
import com.solar.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Anomaly store. The record key is the id derived from the dedup key
 * (unit, type, start, end), so the primary key doubles as the uniqueness
 * constraint: inserts are create-only and a second insert of an equivalent
 * anomaly fails with KEY_EXISTS_ERROR.
 */
@Repository
public class AnomalyRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRepository.class);

    public enum GroupBy {
        TYPE("anomalyType"),
        SEVERITY("severity"),
        STATUS("status");

        private final String bin;

        GroupBy(String bin) {
            this.bin = bin;
        }
    }

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnomalyRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Store a new anomaly unless one with the same id already exists.
     *
     * @return true if this call created the record, false if an equivalent
     *         anomaly was already stored (including by a concurrent run)
     */
    public boolean insertIfAbsent(Anomaly anomaly) {
        WritePolicy createPolicy = new WritePolicy(writePolicy);
        createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        try {
            client.put(createPolicy, key(anomaly.getAnomalyId()), toBins(anomaly));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.debug("Anomaly {} already stored, insert skipped", anomaly.getAnomalyId());
                return false;
            }
            throw e;
        }
    }

    public Anomaly findById(String anomalyId) {
        Record record = client.get(readPolicy, key(anomalyId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public Anomaly findEquivalent(String unitId, AnomalyType type, AffectedPeriod period) {
        return findById(Anomaly.idFor(unitId, type, period.startDate(), period.endDate()));
    }

    /**
     * Write the resolution fields of {@code updated} only if the stored status
     * still equals {@code expectedStatus}. The read and the write are tied by
     * the record generation, so a concurrent change makes this call return false.
     */
    public boolean updateIfStatus(Anomaly updated, AnomalyStatus expectedStatus) {
        Key key = key(updated.getAnomalyId());
        Record record = client.get(readPolicy, key);
        if (record == null) return false;

        String currentStatus = record.getString("status");
        if (!expectedStatus.name().equals(currentStatus)) {
            log.debug("Anomaly {} has status {}, expected {}; update skipped",
                    updated.getAnomalyId(), currentStatus, expectedStatus);
            return false;
        }

        WritePolicy casPolicy = new WritePolicy(writePolicy);
        casPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        casPolicy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        casPolicy.generation = record.generation;

        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("status", updated.getStatus().name()));
        bins.add(new Bin("ackAt", updated.getAcknowledgedAt()));
        bins.add(new Bin("resolvedAt", updated.getResolvedAt()));
        bins.add(new Bin("updatedAt", updated.getUpdatedAt()));
        addIfPresent(bins, "ackBy", updated.getAcknowledgedBy());
        addIfPresent(bins, "resolvedBy", updated.getResolvedBy());
        addIfPresent(bins, "resNotes", updated.getResolutionNotes());

        try {
            client.put(casPolicy, key, bins.toArray(new Bin[0]));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Anomaly {} changed concurrently, update skipped", updated.getAnomalyId());
                return false;
            }
            throw e;
        }
    }

    /**
     * Anomalies matching the filter, newest detection first, paged by the
     * filter's offset and limit.
     */
    public List<Anomaly> query(AnomalyFilter filter) {
        List<Anomaly> matches = new ArrayList<>();
        scan(anomaly -> {
            if (filter.matches(anomaly)) {
                synchronized (matches) {
                    matches.add(anomaly);
                }
            }
        });

        matches.sort(Comparator.comparingLong(Anomaly::getDetectedAt).reversed()
                .thenComparing(Anomaly::getAnomalyId));
        if (filter.offset() >= matches.size()) {
            return new ArrayList<>();
        }
        int end = Math.min(matches.size(), filter.offset() + filter.limit());
        return new ArrayList<>(matches.subList(filter.offset(), end));
    }

    public long count(AnomalyFilter filter) {
        long[] total = new long[1];
        scan(anomaly -> {
            if (filter.matches(anomaly)) {
                synchronized (total) {
                    total[0]++;
                }
            }
        });
        return total[0];
    }

    /**
     * Count anomalies per distinct value of one field, optionally restricted to a unit.
     */
    public Map<String, Long> countGroupedBy(String unitId, GroupBy groupBy) {
        Map<String, Long> counts = new TreeMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    if (unitId != null && !unitId.equals(record.getString("unitId"))) return;
                    String value = record.getString(groupBy.bin);
                    if (value == null) return;
                    synchronized (counts) {
                        counts.merge(value, 1L, Long::sum);
                    }
                });
        return counts;
    }

    public List<Anomaly> findDetectedSince(String unitId, long sinceMillis) {
        List<Anomaly> results = new ArrayList<>();
        scan(anomaly -> {
            if (unitId != null && !unitId.equals(anomaly.getUnitId())) return;
            if (anomaly.getDetectedAt() < sinceMillis) return;
            synchronized (results) {
                results.add(anomaly);
            }
        });
        results.sort(Comparator.comparingLong(Anomaly::getDetectedAt));
        return results;
    }

    private void scan(Consumer<Anomaly> consumer) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    Anomaly anomaly;
                    try {
                        anomaly = mapRecord(record);
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                        return;
                    }
                    consumer.accept(anomaly);
                });
    }

    private Key key(String anomalyId) {
        return new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
    }

    private Bin[] toBins(Anomaly anomaly) {
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("anomalyId", anomaly.getAnomalyId()),
                new Bin("unitId", anomaly.getUnitId()),
                new Bin("anomalyType", anomaly.getAnomalyType().name()),
                new Bin("severity", anomaly.getSeverity().name()),
                new Bin("periodStart", anomaly.getAffectedPeriod().startDate().toString()),
                new Bin("periodEnd", anomaly.getAffectedPeriod().endDate().toString()),
                new Bin("description", anomaly.getDescription()),
                new Bin("details", serializeDetails(anomaly.getDetectionDetails())),
                new Bin("status", anomaly.getStatus().name()),
                new Bin("recAction", anomaly.getRecommendedAction()),
                new Bin("detectedAt", anomaly.getDetectedAt()),
                new Bin("ackAt", anomaly.getAcknowledgedAt()),
                new Bin("resolvedAt", anomaly.getResolvedAt()),
                new Bin("createdAt", anomaly.getCreatedAt()),
                new Bin("updatedAt", anomaly.getUpdatedAt())));

        if (anomaly.getEstimatedEnergyLoss() != null) {
            bins.add(new Bin("estLoss", anomaly.getEstimatedEnergyLoss().doubleValue()));
        }
        addIfPresent(bins, "ackBy", anomaly.getAcknowledgedBy());
        addIfPresent(bins, "resolvedBy", anomaly.getResolvedBy());
        addIfPresent(bins, "resNotes", anomaly.getResolutionNotes());
        return bins.toArray(new Bin[0]);
    }

    private static void addIfPresent(List<Bin> bins, String name, String value) {
        if (value != null) {
            bins.add(new Bin(name, value));
        }
    }

    private Anomaly mapRecord(Record record) {
        return Anomaly.builder()
                .anomalyId(record.getString("anomalyId"))
                .unitId(record.getString("unitId"))
                .anomalyType(AnomalyType.valueOf(record.getString("anomalyType")))
                .severity(Severity.valueOf(record.getString("severity")))
                .affectedPeriod(new AffectedPeriod(
                        LocalDate.parse(record.getString("periodStart")),
                        LocalDate.parse(record.getString("periodEnd"))))
                .description(record.getString("description"))
                .detectionDetails(deserializeDetails(record.getString("details")))
                .status(AnomalyStatus.valueOf(record.getString("status")))
                .recommendedAction(record.getString("recAction"))
                .estimatedEnergyLoss(record.getValue("estLoss") != null ? record.getDouble("estLoss") : null)
                .detectedAt(record.getLong("detectedAt"))
                .acknowledgedAt(record.getLong("ackAt"))
                .acknowledgedBy(record.getString("ackBy"))
                .resolvedAt(record.getLong("resolvedAt"))
                .resolvedBy(record.getString("resolvedBy"))
                .resolutionNotes(record.getString("resNotes"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }

    private String serializeDetails(DetectionDetails details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize detection details", e);
        }
    }

    private DetectionDetails deserializeDetails(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, DetectionDetails.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize detection details", e);
            return null;
        }
    }
}
