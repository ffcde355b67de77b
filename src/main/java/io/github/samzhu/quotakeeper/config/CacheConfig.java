package io.github.samzhu.quotakeeper.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Caffeine 記憶體快取配置。
 *
 * <p>{@value #LIMITS_CACHE} 快取 {@code config/limits} 文件，供配額檢查使用，
 * 過期時間由 {@code quota-keeper.limits.cache-ttl} 控制（預設 5 分鐘）。
 * 每日重置與管理員更新配額時會主動清除。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LIMITS_CACHE = "limitsCache";

    @Bean
    public CacheManager caffeineCacheManager(QuotaKeeperProperties properties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(LIMITS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(properties.limits().cacheTtl())
                .maximumSize(1)
                .build());
        return manager;
    }
}
