package io.github.samzhu.quotakeeper.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link QuotaKeeperProperties} 的型別安全配置綁定，
 * 並提供全域 UTC {@link Clock}，讓重置與健康檢查以注入的「現在」計算週期邊界。
 *
 * @see QuotaKeeperProperties
 */
@Configuration
@EnableConfigurationProperties(QuotaKeeperProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
