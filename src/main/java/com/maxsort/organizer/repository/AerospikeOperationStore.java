package com.maxsort.organizer.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maxsort.organizer.config.AerospikeConfig;
import com.maxsort.organizer.model.OperationRecord;
import com.maxsort.organizer.model.OperationRecordFilter;
import com.maxsort.organizer.model.RecordKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Repository
public class AerospikeOperationStore implements OperationStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeOperationStore.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AerospikeOperationStore(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void recordOperation(OperationRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        Key key = new Key(namespace, AerospikeConfig.SET_OPERATION_LOG, record.getId());

        // Bin names are capped at 15 characters
        Bin idBin = new Bin("id", record.getId());
        Bin kindBin = new Bin("kind", record.getKind() != null ? record.getKind().name() : "");
        Bin refBin = new Bin("referenceId", record.getReferenceId());
        Bin statusBin = new Bin("status", record.getStatus());
        Bin opCountBin = new Bin("opCount", record.getOperationCount());
        Bin doneCountBin = new Bin("completedCount", record.getCompletedCount());
        Bin opsBin = new Bin("operations", serializeList(record.getOperations()));
        Bin rollbackBin = new Bin("rollbackActs", serializeList(record.getRollbackActions()));
        Bin errorBin = new Bin("error", record.getError() != null ? record.getError() : "");
        Bin recordedAtBin = new Bin("recordedAt", record.getRecordedAt());

        client.put(writePolicy, key,
                idBin, kindBin, refBin, statusBin, opCountBin, doneCountBin,
                opsBin, rollbackBin, errorBin, recordedAtBin);
        log.debug("Recorded operation log entry: id={}, kind={}, ref={}, status={}",
                record.getId(), record.getKind(), record.getReferenceId(), record.getStatus());
    }

    @Override
    public List<OperationRecord> getOperations(OperationRecordFilter filter) {
        List<OperationRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_OPERATION_LOG,
                (key, record) -> {
                    try {
                        OperationRecord mapped = mapRecord(record);
                        if (filter.matches(mapped)) {
                            synchronized (results) {
                                results.add(mapped);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read operation log record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(OperationRecord::getRecordedAt).reversed());
        int limit = Math.max(0, filter.getLimit());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private OperationRecord mapRecord(Record record) {
        String kind = record.getString("kind");
        String error = record.getString("error");
        return OperationRecord.builder()
                .id(record.getString("id"))
                .kind(kind != null && !kind.isEmpty() ? RecordKind.valueOf(kind) : null)
                .referenceId(record.getString("referenceId"))
                .status(record.getString("status"))
                .operationCount(record.getInt("opCount"))
                .completedCount(record.getInt("completedCount"))
                .operations(deserializeList(record.getString("operations")))
                .rollbackActions(deserializeList(record.getString("rollbackActs")))
                .error(error != null && !error.isEmpty() ? error : null)
                .recordedAt(record.getLong("recordedAt"))
                .build();
    }

    private String serializeList(List<String> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize list", e);
            return "[]";
        }
    }

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize list", e);
            return new ArrayList<>();
        }
    }
}
