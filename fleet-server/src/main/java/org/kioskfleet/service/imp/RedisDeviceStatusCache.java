package org.kioskfleet.service.imp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.kioskfleet.dto.CachedStatus;
import org.kioskfleet.service.IDeviceStatusCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;

import java.util.List;
import java.util.Optional;

/**
 * Redis-backed status cache. Key: {@code device:{deviceId}:status}, value:
 * JSON {@code {status, last_seen, version}}, fixed TTL.
 *
 * Writers race after their transactions commit, so a write only lands if the
 * stored entry does not carry a newer row version. The check and the write run
 * as one script on the Redis server.
 */
@Service
public class RedisDeviceStatusCache implements IDeviceStatusCache {

    private static final Logger log = LoggerFactory.getLogger(RedisDeviceStatusCache.class);

    // KEYS[1] = key, ARGV[1] = json, ARGV[2] = version (may be empty), ARGV[3] = ttl seconds
    static final String PUT_IF_NEWER_SCRIPT =
            "local current = redis.call('GET', KEYS[1]) " +
            "if current then " +
            "  local ok, stored = pcall(cjson.decode, current) " +
            "  local incoming = tonumber(ARGV[2]) " +
            "  if ok and type(stored) == 'table' and incoming and tonumber(stored['version']) " +
            "      and tonumber(stored['version']) > incoming then " +
            "    return 0 " +
            "  end " +
            "end " +
            "redis.call('SETEX', KEYS[1], ARGV[3], ARGV[1]) " +
            "return 1";

    private final JedisPool pool;
    private final ObjectMapper objectMapper;
    private final long ttlSeconds;

    public RedisDeviceStatusCache(JedisPool pool,
                                  ObjectMapper objectMapper,
                                  @Value("${fleet.cache.status-ttl-seconds:300}") long ttlSeconds) {
        this.pool = pool;
        this.objectMapper = objectMapper;
        this.ttlSeconds = ttlSeconds;
    }

    public static String key(String deviceId) {
        return "device:" + deviceId + ":status";
    }

    @Override
    public void put(String deviceId, CachedStatus status) {
        try (Jedis redis = pool.getResource()) {
            String version = status.version() != null ? status.version().toString() : "";
            Object written = redis.eval(PUT_IF_NEWER_SCRIPT, List.of(key(deviceId)),
                    List.of(objectMapper.writeValueAsString(status), version, Long.toString(ttlSeconds)));
            if (Long.valueOf(0L).equals(written)) {
                log.debug("Cache write skipped, newer entry present: deviceId={}, version={}", deviceId, version);
            }
        } catch (JedisException | JsonProcessingException e) {
            log.warn("Cache write failed: deviceId={}, error={}", deviceId, e.getMessage());
        }
    }

    @Override
    public Optional<CachedStatus> get(String deviceId) {
        try (Jedis redis = pool.getResource()) {
            String json = redis.get(key(deviceId));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, CachedStatus.class));
        } catch (JedisException | JsonProcessingException e) {
            log.warn("Cache read failed: deviceId={}, error={}", deviceId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void evict(String deviceId) {
        try (Jedis redis = pool.getResource()) {
            redis.del(key(deviceId));
        } catch (JedisException e) {
            log.warn("Cache evict failed: deviceId={}, error={}", deviceId, e.getMessage());
        }
    }
}
