package com.cred.freestyle.eventpricing.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;

import java.time.Duration;

/**
 * Redis configuration for the price cache and the customer rate limiter.
 * Configures connection pooling and timeouts. Both users talk to Redis through
 * the StringRedisTemplate provided by Spring Boot, with JSON values written by Jackson.
 *
 * Timeouts are kept short: every Redis caller fails open, so a slow Redis should
 * fail fast rather than hold the event's pool lock.
 *
 * @author Event Pricing Team
 */
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private Integer redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.database:0}")
    private Integer redisDatabase;

    @Value("${spring.data.redis.timeout:500}")
    private Integer redisTimeout;

    @Value("${spring.data.redis.lettuce.pool.max-active:20}")
    private Integer maxActive;

    @Value("${spring.data.redis.lettuce.pool.max-idle:10}")
    private Integer maxIdle;

    @Value("${spring.data.redis.lettuce.pool.min-idle:2}")
    private Integer minIdle;

    @Value("${spring.data.redis.lettuce.pool.max-wait:500}")
    private Long maxWait;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        LettucePoolingClientConfiguration clientConfig = LettucePoolingClientConfiguration.builder()
                .poolConfig(connectionPool())
                .clientOptions(failFastClientOptions())
                .commandTimeout(Duration.ofMillis(redisTimeout))
                .build();

        return new LettuceConnectionFactory(standaloneServer(), clientConfig);
    }

    private RedisStandaloneConfiguration standaloneServer() {
        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(redisHost, redisPort);
        server.setDatabase(redisDatabase);
        if (redisPassword != null && !redisPassword.isEmpty()) {
            server.setPassword(redisPassword);
        }
        return server;
    }

    private GenericObjectPoolConfig<?> connectionPool() {
        GenericObjectPoolConfig<?> pool = new GenericObjectPoolConfig<>();
        pool.setMaxTotal(maxActive);
        pool.setMaxIdle(maxIdle);
        pool.setMinIdle(minIdle);
        // a booking waits on this while it holds the pool lock
        pool.setMaxWait(Duration.ofMillis(maxWait));
        pool.setTestWhileIdle(true);
        return pool;
    }

    private ClientOptions failFastClientOptions() {
        return ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(Duration.ofMillis(redisTimeout))
                        .keepAlive(true)
                        .build())
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .build();
    }
}
