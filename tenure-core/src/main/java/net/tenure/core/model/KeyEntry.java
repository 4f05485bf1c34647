package net.tenure.core.model;

import java.time.Instant;

/** A live key of a TTL key/value store. */
public record KeyEntry(
        String key,
        String value,
        Instant expiresAt,
        Instant writtenAt    // last SET or EXPIRE
) {
    public boolean expiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public LeaseRecord toRecord() {
        return new LeaseRecord(value, expiresAt, writtenAt);
    }
}
