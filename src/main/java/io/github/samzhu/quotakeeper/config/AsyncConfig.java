package io.github.samzhu.quotakeeper.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 重置任務執行緒池配置。
 *
 * <p>手動觸發 {@code all} 時，三種重置會並行送入 {@value #RESET_EXECUTOR}。
 * 單一重置內的批次仍依序提交。
 */
@Configuration
public class AsyncConfig {

    public static final String RESET_EXECUTOR = "reset-executor";

    @Bean(name = RESET_EXECUTOR)
    public Executor resetExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(3);
        e.setMaxPoolSize(3);
        e.setQueueCapacity(30);
        e.setThreadNamePrefix("reset-");
        e.initialize();
        return e;
    }
}
