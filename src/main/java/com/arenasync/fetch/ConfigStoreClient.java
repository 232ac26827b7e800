package com.arenasync.fetch;

import java.io.IOException;
import java.util.Optional;

public interface ConfigStoreClient {
    Optional<ConfigEntry> get(String namespace, String name) throws IOException;
}
