package net.tenure.core.spi;

/** Insert rejected because the key already exists. Expected when losing a race, not a failure. */
public class DuplicateKeyException extends Exception {
    private final String key;

    public DuplicateKeyException(String key, Throwable cause) {
        super("Duplicate key: " + key, cause);
        this.key = key;
    }

    public String key() { return key; }
}
