package net.tenure.core.backend;

import net.tenure.core.model.BackendKind;
import net.tenure.core.spi.Clock;
import net.tenure.core.spi.KeyValueStore;
import net.tenure.core.spi.LeaseDocumentStore;
import net.tenure.core.spi.StorageBackend;
import net.tenure.core.spi.StorageBackendFactory;
import net.tenure.core.spi.TxRunner;
import net.tenure.core.store.InMemoryKeyValueStore;
import net.tenure.core.store.InMemoryLeaseDocumentStore;

import java.time.Duration;

/** The one place a backend kind turns into an implementation. */
public final class StoreBackedBackendFactory implements StorageBackendFactory {
    private final LeaseDocumentStore documents;
    private final KeyValueStore keys;
    private final TxRunner tx;
    private final Duration leaseDuration;

    public StoreBackedBackendFactory(LeaseDocumentStore documents,
                                     KeyValueStore keys,
                                     TxRunner tx,
                                     Duration leaseDuration) {
        this.documents = documents;
        this.keys = keys;
        this.tx = tx;
        this.leaseDuration = leaseDuration;
    }

    /** Both stores live in this JVM and outlast individual runs, like a database server would. */
    public static StoreBackedBackendFactory inMemory(Clock clock, Duration leaseDuration) {
        return new StoreBackedBackendFactory(new InMemoryLeaseDocumentStore(),
                new InMemoryKeyValueStore(clock), TxRunner.direct(), leaseDuration);
    }

    @Override
    public StorageBackend open(BackendKind kind) {
        return switch (kind) {
            case CONDITIONAL_WRITE -> new ConditionalWriteBackend(documents, tx, leaseDuration);
            case TTL_KEY -> new TtlKeyBackend(keys, tx, leaseDuration);
        };
    }

    public LeaseDocumentStore documents() { return documents; }

    public KeyValueStore keys() { return keys; }
}
