package com.playarr.livetv.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring Cache configuration backed by Caffeine.
 *
 * Rewritten M3U playlists are cached per user and base URL; every completed sync evicts the
 * whole cache so clients never see a playlist older than the cached live.m3u.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String PLAYLIST_CACHE = "livetvPlaylists";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(PLAYLIST_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.MINUTES)
                .maximumSize(500)
                .recordStats());
        return cacheManager;
    }
}
