package com.arenasync.fetch;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

public interface SecretStore {
    Optional<Map<String, byte[]>> get(String namespace, String name) throws IOException;
}
