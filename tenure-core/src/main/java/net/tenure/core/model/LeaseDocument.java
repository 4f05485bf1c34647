package net.tenure.core.model;

import java.time.Instant;

/** Document layout of the conditional-write backend: {id, owner, expiresAt, updatedAt} in epoch ms. */
public record LeaseDocument(
        String id,
        String owner,
        Long expiresAt,     // null = no lease written yet
        long updatedAt
) {
    public LeaseRecord toRecord() {
        return new LeaseRecord(owner,
                expiresAt == null ? null : Instant.ofEpochMilli(expiresAt),
                Instant.ofEpochMilli(updatedAt));
    }
}
