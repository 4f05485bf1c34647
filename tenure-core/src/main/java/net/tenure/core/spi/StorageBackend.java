package net.tenure.core.spi;

import net.tenure.core.model.BackendKind;
import net.tenure.core.model.LeaseRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * Atomic primitives over the single shared lease record.
 * tryAcquire/renew never throw: store errors come back as {@code false}, the same as losing.
 */
public interface StorageBackend extends AutoCloseable {
    BackendKind kind();

    /** Takes the lease for nodeId iff it is absent or expired at now. Exactly one concurrent caller may win. */
    boolean tryAcquire(String nodeId, Instant now);

    /** Extends the lease iff nodeId owns it. */
    boolean renew(String nodeId, Instant now);

    /** Deletes the record whoever owns it. Idempotent. */
    void release();

    /** Clears all backend state at the start of a run. */
    void reset() throws Exception;

    Optional<LeaseRecord> current() throws Exception;

    @Override
    void close();
}
