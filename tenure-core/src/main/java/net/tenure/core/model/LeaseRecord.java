package net.tenure.core.model;

import java.time.Instant;

/** The single shared lease as seen through a backend. */
public record LeaseRecord(
        String ownerId,
        Instant expiresAt,
        Instant updatedAt
) {
}
