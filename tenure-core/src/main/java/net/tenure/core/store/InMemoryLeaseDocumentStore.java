package net.tenure.core.store;

import net.tenure.core.model.LeaseDocument;
import net.tenure.core.spi.DuplicateKeyException;
import net.tenure.core.spi.LeaseDocumentStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** Documents keyed by id. Conditional updates run inside the map's per-key compute. */
public final class InMemoryLeaseDocumentStore implements LeaseDocumentStore {
    private final ConcurrentMap<String, LeaseDocument> documents = new ConcurrentHashMap<>();

    @Override
    public boolean updateIfExpired(String id, String owner, long expiresAt, long now) {
        AtomicBoolean matched = new AtomicBoolean();
        documents.computeIfPresent(id, (k, doc) -> {
            if (doc.expiresAt() != null && doc.expiresAt() >= now) return doc;
            matched.set(true);
            return new LeaseDocument(id, owner, expiresAt, now);
        });
        return matched.get();
    }

    @Override
    public void insert(LeaseDocument doc) throws DuplicateKeyException {
        if (documents.putIfAbsent(doc.id(), doc) != null) {
            throw new DuplicateKeyException(doc.id(), null);
        }
    }

    @Override
    public boolean updateIfOwner(String id, String owner, long expiresAt, long now) {
        AtomicBoolean matched = new AtomicBoolean();
        documents.computeIfPresent(id, (k, doc) -> {
            if (!doc.owner().equals(owner)) return doc;
            matched.set(true);
            return new LeaseDocument(id, owner, expiresAt, now);
        });
        return matched.get();
    }

    @Override
    public void delete(String id) {
        documents.remove(id);
    }

    @Override
    public void deleteAll() {
        documents.clear();
    }

    @Override
    public Optional<LeaseDocument> findById(String id) {
        return Optional.ofNullable(documents.get(id));
    }
}
