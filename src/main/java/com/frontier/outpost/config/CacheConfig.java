package com.frontier.outpost.config;

import com.frontier.outpost.model.InventoryItem;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Caffeine cache configuration.
 *
 * INVENTORY CACHE - Last listing read from each outpost
 *    - Key: node name + filter, Value: the listed items
 *    - TTL: 60 seconds (a sync touching the node invalidates it earlier)
 *    - Never consulted by a sync run, which always reads the live target
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.inventory.max-size:100}")
    private int inventoryMaxSize;

    @Value("${app.cache.inventory.ttl-seconds:60}")
    private int inventoryTtlSeconds;

    @Bean
    public Cache<String, List<InventoryItem>> inventoryCache() {
        log.info("Creating inventory cache: maxSize={}, ttl={}s", inventoryMaxSize, inventoryTtlSeconds);
        return Caffeine.newBuilder()
                .maximumSize(inventoryMaxSize)
                .expireAfterWrite(Duration.ofSeconds(inventoryTtlSeconds))
                .recordStats()
                .build();
    }
}
