package com.marketdesk.jobs.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis cache configuration.
 * Queue, task records and job timestamps go through the auto-configured
 * StringRedisTemplate so external workers can read the raw JSON.
 */
@Configuration
@EnableCaching
public class RedisConfig {

        public static final String TICKER_SNAPSHOT_CACHE = "tickerSnapshots";
        public static final String SEC_TICKERS_CACHE = "secCompanyTickers";

        @Bean
        public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory) {
                RedisCacheConfiguration defaultConfig = cacheConfig(Duration.ofHours(1));

                // Historical snapshots never change once the day is over
                RedisCacheConfiguration snapshotConfig = cacheConfig(Duration.ofHours(24));

                RedisCacheConfiguration secConfig = cacheConfig(Duration.ofHours(6));

                return RedisCacheManager.builder(connectionFactory)
                                .cacheDefaults(defaultConfig)
                                .withCacheConfiguration(TICKER_SNAPSHOT_CACHE, snapshotConfig)
                                .withCacheConfiguration(SEC_TICKERS_CACHE, secConfig)
                                .build();
        }

        private RedisCacheConfiguration cacheConfig(Duration ttl) {
                return RedisCacheConfiguration.defaultCacheConfig()
                                .entryTtl(ttl)
                                .serializeKeysWith(
                                                RedisSerializationContext.SerializationPair
                                                                .fromSerializer(new StringRedisSerializer()))
                                .serializeValuesWith(
                                                RedisSerializationContext.SerializationPair
                                                                .fromSerializer(new GenericJackson2JsonRedisSerializer()))
                                .disableCachingNullValues();
        }
}
