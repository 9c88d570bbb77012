package org.kioskfleet.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.net.URI;

@Configuration
public class RedisConfig {

    private static final int DEFAULT_PORT = 6379;

    @Value("${fleet.redis.url:redis://localhost:6379}")
    private String redisUrl;

    @Value("${fleet.redis.timeout-ms:5000}")
    private int timeoutMs;

    @Value("${fleet.redis.pool.max-total:50}")
    private int maxTotal;

    @Value("${fleet.redis.pool.max-idle:10}")
    private int maxIdle;

    @Value("${fleet.redis.pool.min-idle:2}")
    private int minIdle;

    @Bean(destroyMethod = "close")
    public JedisPool jedisPool() {
        URI uri = URI.create(redisUrl);

        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxTotal(maxTotal);
        config.setMaxIdle(maxIdle);
        config.setMinIdle(minIdle);
        config.setJmxEnabled(false);

        return new JedisPool(
                config,
                uri.getHost(),
                uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort(),
                timeoutMs,
                password(uri),
                "rediss".equalsIgnoreCase(uri.getScheme())   // TLS
        );
    }

    // userInfo is either "password" or "user:password"
    private static String password(URI uri) {
        String userInfo = uri.getUserInfo();
        if (userInfo == null || userInfo.isEmpty()) {
            return null;
        }
        int colon = userInfo.indexOf(':');
        return colon < 0 ? userInfo : userInfo.substring(colon + 1);
    }
}
