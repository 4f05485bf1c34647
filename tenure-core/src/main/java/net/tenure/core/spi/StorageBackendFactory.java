package net.tenure.core.spi;

import net.tenure.core.model.BackendKind;

/** Opens a fresh backend connection for one election run. */
@FunctionalInterface
public interface StorageBackendFactory {
    StorageBackend open(BackendKind kind) throws Exception;
}
