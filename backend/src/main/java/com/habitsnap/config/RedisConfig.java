package com.habitsnap.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the scheduled job run guard.
 *
 * Scheduled jobs record a short-lived key per period ("jobs:penalty-sweep:2024-03-01")
 * so that when several instances run, only one of them executes the period's job.
 * Values are plain strings, so a single String template is all the service needs.
 *
 * @see com.habitsnap.scheduling.JobRunGuard
 */
@Configuration
@Slf4j
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    /**
     * Lettuce-based connection factory with standalone configuration.
     *
     * @return configured RedisConnectionFactory
     */
    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);

        log.info("Configuring Redis connection factory: host={}, port={}", redisHost, redisPort);

        return new LettuceConnectionFactory(config);
    }

    /**
     * RedisTemplate with String serialization for keys and values.
     *
     * @param redisConnectionFactory the Redis connection factory
     * @return configured RedisTemplate for string operations
     */
    @Bean
    public RedisTemplate<String, String> redisStringTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setValueSerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);
        template.setHashValueSerializer(stringSerializer);

        template.afterPropertiesSet();

        log.debug("RedisTemplate configured for String operations");
        return template;
    }
}
