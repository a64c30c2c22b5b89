package com.logimatrix.tracking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimatrix.tracking.dto.FixRecord;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis configuration for the hot position cache and the fleet-directory cache.
 *
 * Architecture Decision:
 * The latest fix per vehicle and per shipment lives in Redis with a short TTL
 * (5 minutes by default). Every engine instance reads the same hot view, and an
 * expired key simply means "no recent fix".
 *
 * Key layout:
 * - position:vehicle:{vehicleId}  -> FixRecord JSON
 * - position:shipment:{shipmentId} -> FixRecord JSON
 */
@Configuration
@EnableCaching
public class RedisConfig {

    public static final String FLEET_VEHICLE_CACHE = "fleet-vehicles";

    /**
     * Typed template for hot fixes.
     *
     * Uses the application ObjectMapper so Instant fields are written the same
     * way as in REST responses.
     */
    @Bean
    public RedisTemplate<String, FixRecord> fixRedisTemplate(RedisConnectionFactory connectionFactory,
                                                            ObjectMapper objectMapper) {
        RedisTemplate<String, FixRecord> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        // Use String serializer for keys (e.g., "position:vehicle:VH-1")
        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());

        Jackson2JsonRedisSerializer<FixRecord> fixSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, FixRecord.class);
        template.setValueSerializer(fixSerializer);
        template.setHashValueSerializer(fixSerializer);

        template.afterPropertiesSet();
        return template;
    }

    /**
     * Cache manager for Spring's @Cacheable annotation.
     *
     * Cache Strategy:
     * - TTL: 10 minutes (fleet membership changes rarely, but deactivations must land)
     * - Null values: not cached
     */
    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        RedisCacheConfiguration config = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(10))
            .disableCachingNullValues()
            .prefixCacheNameWith("tracking:")
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer())
            )
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new GenericJackson2JsonRedisSerializer()
                )
            );

        return RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(config)
            .build();
    }
}
