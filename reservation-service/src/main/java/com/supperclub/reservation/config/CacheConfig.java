package com.supperclub.reservation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supperclub.reservation.cache.RedisAvailabilityCache;
import com.supperclub.reservation.service.AvailabilitySnapshot;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;

import java.util.Set;

@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory,
                                     ObjectMapper objectMapper,
                                     ReservationProperties properties) {
        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(availabilityCacheConfiguration(objectMapper, properties))
                .initialCacheNames(Set.of(RedisAvailabilityCache.CACHE_NAME))
                .build();
    }

    static RedisCacheConfiguration availabilityCacheConfiguration(ObjectMapper objectMapper,
                                                                  ReservationProperties properties) {
        return RedisCacheConfiguration.defaultCacheConfig()
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(
                        new Jackson2JsonRedisSerializer<>(objectMapper, AvailabilitySnapshot.class)))
                .entryTtl(properties.getAvailability().getCacheTtl())
                .disableCachingNullValues();
    }
}
