package com.example.mlrundb.kv;

import java.time.Duration;
import java.util.Optional;

/** Key-value store holding opaque byte values. */
public interface KvClient {
    Optional<byte[]> get(String key);
    void set(String key, byte[] value, Duration ttl);
}
