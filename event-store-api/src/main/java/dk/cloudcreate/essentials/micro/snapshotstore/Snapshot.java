package dk.cloudcreate.essentials.micro.snapshotstore;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A cached materialization of an aggregate's state at a known version
 */
public final class Snapshot {
    /**
     * The aggregate type the snapshot belongs to
     */
    public final String              aggregateType;
    public final String              aggregateId;
    /**
     * The aggregate state at the time of the snapshot
     */
    public final Map<String, Object> aggregateRoot;
    /**
     * The aggregate version that {@link #aggregateRoot} reflects
     */
    public final long                lastVersion;
    public final OffsetDateTime      createdAt;

    public Snapshot(String aggregateType,
                    String aggregateId,
                    Map<String, ?> aggregateRoot,
                    long lastVersion,
                    OffsetDateTime createdAt) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateRoot = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(requireNonNull(aggregateRoot, "No aggregateRoot provided")));
        this.lastVersion = lastVersion;
        this.createdAt = requireNonNull(createdAt, "No createdAt provided").withOffsetSameInstant(ZoneOffset.UTC);
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public Map<String, Object> aggregateRoot() {
        return aggregateRoot;
    }

    public long lastVersion() {
        return lastVersion;
    }

    public OffsetDateTime createdAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot)) return false;
        Snapshot that = (Snapshot) o;
        return lastVersion == that.lastVersion &&
                aggregateType.equals(that.aggregateType) &&
                aggregateId.equals(that.aggregateId) &&
                aggregateRoot.equals(that.aggregateRoot) &&
                createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, aggregateId, lastVersion);
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "aggregateType='" + aggregateType + '\'' +
                ", aggregateId='" + aggregateId + '\'' +
                ", lastVersion=" + lastVersion +
                ", createdAt=" + createdAt +
                '}';
    }
}
