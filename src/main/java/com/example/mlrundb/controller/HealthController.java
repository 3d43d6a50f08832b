package com.example.mlrundb.controller;

import com.example.mlrundb.error.NotFoundException;
import com.example.mlrundb.kv.KvClient;
import com.example.mlrundb.store.StoreClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HealthController {

    static final String CHECK_PATH = "/health/check";

    private final KvClient kvClient;
    private final StoreClient storeClient;

    public HealthController(KvClient kvClient, StoreClient storeClient) {
        this.kvClient = kvClient;
        this.storeClient = storeClient;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(this::check).subscribeOn(Schedulers.boundedElastic());
    }

    ResponseEntity<Map<String, Object>> check() {
        Map<String, Object> health = new HashMap<>();
        health.put("service", "mlrun-metadata-db");
        health.put("version", "1.0.0");

        boolean up = true;
        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            up = false;
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            storeClient.get(CHECK_PATH, List.of());
            health.put("mongodb", "UP");
        } catch (NotFoundException e) {
            health.put("mongodb", "UP");
        } catch (Exception e) {
            up = false;
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        health.put("status", up ? "UP" : "DOWN");
        return up ? ResponseEntity.ok(health) : ResponseEntity.status(503).body(health);
    }
}
