package net.tenure.core.backend;

import net.tenure.core.model.BackendKind;
import net.tenure.core.model.KeyEntry;
import net.tenure.core.model.LeaseRecord;
import net.tenure.core.spi.KeyValueStore;
import net.tenure.core.spi.StorageBackend;
import net.tenure.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Lease as a single key with native TTL: "leader" -> owner id.
 * Acquisition is one SET NX PX. Renewal is GET then PEXPIRE in two separate calls:
 * if the key changes hands between them, the refresh extends the new owner's lease.
 */
public final class TtlKeyBackend implements StorageBackend {
    private static final Logger log = LoggerFactory.getLogger(TtlKeyBackend.class);

    public static final String LEADER_KEY = "leader";

    private final KeyValueStore store;
    private final TxRunner tx;
    private final Duration leaseDuration;

    public TtlKeyBackend(KeyValueStore store, TxRunner tx, Duration leaseDuration) {
        this.store = store;
        this.tx = tx;
        this.leaseDuration = leaseDuration;
    }

    @Override
    public BackendKind kind() { return BackendKind.TTL_KEY; }

    @Override
    public boolean tryAcquire(String nodeId, Instant now) {
        try {
            return tx.required(() -> store.setIfAbsent(LEADER_KEY, nodeId, leaseDuration));
        } catch (Exception e) {
            log.error("Lease acquisition failed for {}: {}", nodeId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public boolean renew(String nodeId, Instant now) {
        try {
            Optional<String> owner = tx.required(() -> store.get(LEADER_KEY));
            if (owner.isEmpty() || !owner.get().equals(nodeId)) {
                return false;
            }
            // not atomic with the read above
            tx.required(() -> store.expire(LEADER_KEY, leaseDuration));
            return true;
        } catch (Exception e) {
            log.error("Lease renewal failed for {}: {}", nodeId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void release() {
        try {
            tx.required(() -> { store.delete(LEADER_KEY); return null; });
        } catch (Exception e) {
            log.error("Lease release failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void reset() throws Exception {
        tx.required(() -> { store.delete(LEADER_KEY); return null; });
    }

    @Override
    public Optional<LeaseRecord> current() throws Exception {
        return tx.required(() -> store.entry(LEADER_KEY)).map(KeyEntry::toRecord);
    }

    @Override
    public void close() {
        log.debug("TTL-key backend closed");
    }
}
