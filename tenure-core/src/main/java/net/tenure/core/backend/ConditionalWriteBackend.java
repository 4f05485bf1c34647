package net.tenure.core.backend;

import net.tenure.core.model.BackendKind;
import net.tenure.core.model.LeaseDocument;
import net.tenure.core.model.LeaseRecord;
import net.tenure.core.spi.DuplicateKeyException;
import net.tenure.core.spi.LeaseDocumentStore;
import net.tenure.core.spi.StorageBackend;
import net.tenure.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Optimistic conditional update against a document store.
 * <ol>
 *     <li>update "current-leader" where the lease is missing or expired</li>
 *     <li>nothing matched: insert the document; a duplicate key means another node got there first</li>
 * </ol>
 * Renewal is a single update matching {id, owner}.
 */
public final class ConditionalWriteBackend implements StorageBackend {
    private static final Logger log = LoggerFactory.getLogger(ConditionalWriteBackend.class);

    public static final String LEADER_DOCUMENT_ID = "current-leader";

    private final LeaseDocumentStore store;
    private final TxRunner tx;
    private final Duration leaseDuration;

    public ConditionalWriteBackend(LeaseDocumentStore store, TxRunner tx, Duration leaseDuration) {
        this.store = store;
        this.tx = tx;
        this.leaseDuration = leaseDuration;
    }

    @Override
    public BackendKind kind() { return BackendKind.CONDITIONAL_WRITE; }

    @Override
    public boolean tryAcquire(String nodeId, Instant now) {
        long nowMs = now.toEpochMilli();
        long expiresAt = nowMs + leaseDuration.toMillis();
        try {
            boolean taken = tx.required(() -> store.updateIfExpired(LEADER_DOCUMENT_ID, nodeId, expiresAt, nowMs));
            if (taken) return true;

            try {
                tx.required(() -> {
                    store.insert(new LeaseDocument(LEADER_DOCUMENT_ID, nodeId, expiresAt, nowMs));
                    return null;
                });
                return true;
            } catch (DuplicateKeyException lost) {
                // live lease, or a concurrent insert won
                log.debug("{} lost the insert race on {}", nodeId, lost.key());
                return false;
            }
        } catch (Exception e) {
            log.error("Lease acquisition failed for {}: {}", nodeId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public boolean renew(String nodeId, Instant now) {
        long nowMs = now.toEpochMilli();
        try {
            return tx.required(() -> store.updateIfOwner(LEADER_DOCUMENT_ID, nodeId, nowMs + leaseDuration.toMillis(), nowMs));
        } catch (Exception e) {
            log.error("Lease renewal failed for {}: {}", nodeId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void release() {
        try {
            tx.required(() -> { store.delete(LEADER_DOCUMENT_ID); return null; });
        } catch (Exception e) {
            log.error("Lease release failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void reset() throws Exception {
        tx.required(() -> { store.deleteAll(); return null; });
    }

    @Override
    public Optional<LeaseRecord> current() throws Exception {
        return tx.required(() -> store.findById(LEADER_DOCUMENT_ID)).map(LeaseDocument::toRecord);
    }

    @Override
    public void close() {
        log.debug("Conditional-write backend closed");
    }
}
