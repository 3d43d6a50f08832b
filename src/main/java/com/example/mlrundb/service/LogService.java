package com.example.mlrundb.service;

import com.example.mlrundb.error.NotFoundException;
import com.example.mlrundb.kv.KvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/** Run logs, kept byte for byte in the key-value store. */
@Service
public class LogService {

    private static final Logger logger = LoggerFactory.getLogger(LogService.class);

    private final KvClient kvClient;

    @Value("${app.log.key-prefix:log:}")
    private String keyPrefix = "log:";

    @Value("${app.log.ttl-sec:0}")
    private long ttlSec;

    public LogService(KvClient kvClient) {
        this.kvClient = kvClient;
    }

    public void store(String project, String uid, byte[] body) {
        String key = key(project, uid);
        Duration ttl = ttlSec > 0 ? Duration.ofSeconds(ttlSec) : null;
        kvClient.set(key, body, ttl);
        logger.info("Stored log {} ({} bytes)", key, body.length);
    }

    public byte[] read(String project, String uid) {
        String key = key(project, uid);
        return kvClient.get(key)
                .orElseThrow(() -> new NotFoundException(key));
    }

    String key(String project, String uid) {
        return keyPrefix + project + "-" + uid;
    }
}
