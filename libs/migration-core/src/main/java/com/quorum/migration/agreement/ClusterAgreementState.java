package com.quorum.migration.agreement;

import com.datastax.oss.driver.api.core.metadata.Metadata;
import com.datastax.oss.driver.api.core.metadata.Node;
import com.datastax.oss.driver.api.core.metadata.NodeState;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Snapshot of the schema versions reported by the cluster's UP nodes after one DDL statement.
 *
 * <p>Lives only as long as the agreement wait for that statement.
 *
 * @param nodeSchemaVersions schema version per node endpoint; null when a node has not reported
 * @param polls number of agreement checks made
 * @param elapsed time spent since the statement was issued
 */
public record ClusterAgreementState(Map<String, UUID> nodeSchemaVersions, int polls, Duration elapsed) {

    public ClusterAgreementState {
        nodeSchemaVersions = Collections.unmodifiableMap(new TreeMap<>(nodeSchemaVersions));
    }

    /** Reads the versions known to the driver's metadata for every UP node. */
    public static ClusterAgreementState capture(Metadata metadata, int polls, Duration elapsed) {
        Map<String, UUID> versions = new TreeMap<>();
        for (Node node : metadata.getNodes().values()) {
            if (node.getState() == NodeState.UP) {
                versions.put(String.valueOf(node.getEndPoint()), node.getSchemaVersion());
            }
        }
        return new ClusterAgreementState(versions, polls, elapsed);
    }

    /** Number of distinct schema versions reported, a missing version counting as one. */
    public long distinctVersions() {
        return nodeSchemaVersions.values().stream().map(v -> Objects.toString(v)).distinct().count();
    }

    /** True when all UP nodes report the same, known, schema version. */
    public boolean agreed() {
        return distinctVersions() <= 1 && !nodeSchemaVersions.containsValue(null);
    }

    /** One-line summary for log lines and exception messages. */
    public String describe() {
        return "%d distinct schema version(s) across %d UP node(s) after %d poll(s): %s"
                .formatted(distinctVersions(), nodeSchemaVersions.size(), polls, nodeSchemaVersions);
    }
}
