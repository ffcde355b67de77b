package io.github.samzhu.quotakeeper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 排程執行緒池（2 執行緒），讓長時間的重置不會阻塞健康檢查。
 */
@Configuration
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "taskScheduler";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }
}
