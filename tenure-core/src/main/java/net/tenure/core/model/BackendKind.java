package net.tenure.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Storage backend flavours.
 * A = document store with optimistic conditional update, B = key/value store with set-if-absent + TTL.
 */
public enum BackendKind {
    CONDITIONAL_WRITE("A", "conditional-write", "mongodb", "ConditionalWriteBackend"),
    TTL_KEY("B", "ttl-key", "redis", "TTLKeyBackend");

    private final String code;
    private final String label;
    private final List<String> aliases;

    BackendKind(String code, String label, String... aliases) {
        this.code = code;
        this.label = label;
        this.aliases = List.of(aliases);
    }

    public static BackendKind from(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("backend is required");
        String v = s.trim();
        for (BackendKind k : values()) {
            if (k.code.equalsIgnoreCase(v) || k.label.equalsIgnoreCase(v)
                    || k.name().equalsIgnoreCase(v.replace('-', '_'))
                    || k.aliases.stream().anyMatch(v::equalsIgnoreCase)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + s.toUpperCase(Locale.ROOT));
    }

    public String code() { return code; }

    public String label() { return label; }
}
