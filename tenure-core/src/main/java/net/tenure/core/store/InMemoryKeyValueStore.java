package net.tenure.core.store;

import net.tenure.core.model.KeyEntry;
import net.tenure.core.spi.Clock;
import net.tenure.core.spi.KeyValueStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** Keys expire lazily: an entry past its expiry is treated as absent and dropped on the next touch. */
public final class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentMap<String, KeyEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.now();
        AtomicBoolean written = new AtomicBoolean();
        entries.compute(key, (k, cur) -> {
            if (cur != null && !cur.expiredAt(now)) return cur;
            written.set(true);
            return new KeyEntry(key, value, now.plus(ttl), now);
        });
        return written.get();
    }

    @Override
    public Optional<String> get(String key) {
        return entry(key).map(KeyEntry::value);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        Instant now = clock.now();
        AtomicBoolean refreshed = new AtomicBoolean();
        entries.computeIfPresent(key, (k, cur) -> {
            if (cur.expiredAt(now)) return null;
            refreshed.set(true);
            return new KeyEntry(key, cur.value(), now.plus(ttl), now);
        });
        return refreshed.get();
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public Optional<KeyEntry> entry(String key) {
        KeyEntry cur = entries.get(key);
        if (cur == null) return Optional.empty();
        if (cur.expiredAt(clock.now())) {
            entries.remove(key, cur);
            return Optional.empty();
        }
        return Optional.of(cur);
    }
}
