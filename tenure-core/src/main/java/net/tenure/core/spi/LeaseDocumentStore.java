package net.tenure.core.spi;

import net.tenure.core.model.LeaseDocument;

import java.util.Optional;

/** Document store with single-document conditional updates. Each call is atomic on its own. */
public interface LeaseDocumentStore {
    /** Sets owner/expiresAt/updatedAt only when the document exists and its lease is missing or older than now */
    boolean updateIfExpired(String id, String owner, long expiresAt, long now) throws Exception;

    /** @throws DuplicateKeyException when a document with the same id exists */
    void insert(LeaseDocument doc) throws Exception;

    /** Sets expiresAt/updatedAt only when the owner matches */
    boolean updateIfOwner(String id, String owner, long expiresAt, long now) throws Exception;

    void delete(String id) throws Exception;

    void deleteAll() throws Exception;

    Optional<LeaseDocument> findById(String id) throws Exception;
}
