package com.example.mlrundb.kv;

import com.example.mlrundb.error.BackendException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Component
public class RedisKvClient implements KvClient {

    private final RedisTemplate<String, byte[]> redis;

    @Autowired
    public RedisKvClient(RedisTemplate<String, byte[]> redis) {
        this.redis = redis;
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw translate("get " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(key, value);
            } else {
                redis.opsForValue().set(key, value, ttl);
            }
        } catch (DataAccessException e) {
            throw translate("set " + key, e);
        }
    }

    private static BackendException translate(String operation, DataAccessException e) {
        int status = e instanceof DataAccessResourceFailureException ? 503 : 500;
        return new BackendException(status, "Redis " + operation + " failed: " + e.getMessage(), e);
    }
}
