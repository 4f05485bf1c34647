package net.tenure.core.spi;

import net.tenure.core.model.KeyEntry;

import java.time.Duration;
import java.util.Optional;

/** Key/value store with native expiry. Expired keys behave as absent. */
public interface KeyValueStore {
    /** SET key value NX PX ttl */
    boolean setIfAbsent(String key, String value, Duration ttl) throws Exception;

    Optional<String> get(String key) throws Exception;

    /** PEXPIRE: resets the TTL of a live key whatever its value; false when the key is absent */
    boolean expire(String key, Duration ttl) throws Exception;

    void delete(String key) throws Exception;

    Optional<KeyEntry> entry(String key) throws Exception;
}
