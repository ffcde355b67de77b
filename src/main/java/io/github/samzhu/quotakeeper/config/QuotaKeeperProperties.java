package io.github.samzhu.quotakeeper.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Quota Keeper 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link ResetConfig} - 重置批次設定，控制每批寫入的文件上限</li>
 *   <li>{@link ScheduleConfig} - 排程開關</li>
 *   <li>{@link HealthConfig} - 健康檢查的時間窗口緩衝</li>
 *   <li>{@link LimitsConfig} - 配額預設值（{@code config/limits} 文件不存在時使用）</li>
 *   <li>{@link AdminConfig} - 管理員 API Key</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * quota-keeper:
 *   reset:
 *     batch-size: 500
 *   schedule:
 *     enabled: true
 *   health:
 *     window-buffer: 1h
 *   limits:
 *     anonymous-limit: 10
 *     reset-hour: 0
 *     cache-ttl: 5m
 *     tiers:
 *       free:  { daily-limit: 10,  weekly-limit: 50,  monthly-limit: 200 }
 *       pro:   { daily-limit: 100, weekly-limit: 500, monthly-limit: 2000 }
 *       admin: { daily-limit: -1,  weekly-limit: -1,  monthly-limit: -1 }
 *   admin:
 *     api-keys: [ "change-me" ]
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "quota-keeper")
public record QuotaKeeperProperties(
    ResetConfig reset,
    ScheduleConfig schedule,
    HealthConfig health,
    LimitsConfig limits,
    AdminConfig admin
) {
    public QuotaKeeperProperties {
        if (reset == null) {
            reset = ResetConfig.defaults();
        }
        if (schedule == null) {
            schedule = ScheduleConfig.defaults();
        }
        if (health == null) {
            health = HealthConfig.defaults();
        }
        if (limits == null) {
            limits = LimitsConfig.defaults();
        }
        if (admin == null) {
            admin = new AdminConfig(List.of());
        }
    }

    /**
     * 重置批次設定。
     *
     * <p>每一批次為一次獨立提交的 bulk write，批次之間不具原子性。
     *
     * @param batchSize 每批最多更新的用戶文件數，預設 500
     */
    public record ResetConfig(
        int batchSize
    ) {
        public ResetConfig {
            if (batchSize <= 0) {
                batchSize = 500;
            }
        }

        public static ResetConfig defaults() {
            return new ResetConfig(500);
        }
    }

    /**
     * 排程設定。
     *
     * <p>各 Cron 表達式（{@code quota-keeper.schedule.daily-cron} 等）由
     * {@code ResetScheduler} 的 {@code @Scheduled} 直接解析，不經此 record；
     * 設為 {@code "-"} 可單獨停用某一個排程。
     *
     * @param enabled 是否啟用排程觸發，預設 true
     */
    public record ScheduleConfig(
        Boolean enabled
    ) {
        public ScheduleConfig {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
        }

        public static ScheduleConfig defaults() {
            return new ScheduleConfig(true);
        }
    }

    /**
     * 健康檢查設定。
     *
     * <p>每日重置的檢查窗口為 24 小時加上 {@code windowBuffer}。
     *
     * @param windowBuffer 窗口緩衝，預設 1 小時
     */
    public record HealthConfig(
        Duration windowBuffer
    ) {
        public HealthConfig {
            if (windowBuffer == null || windowBuffer.isNegative()) {
                windowBuffer = Duration.ofHours(1);
            }
        }

        public static HealthConfig defaults() {
            return new HealthConfig(Duration.ofHours(1));
        }

        /**
         * 每日重置的完整檢查窗口。
         */
        public Duration dailyWindow() {
            return Duration.ofHours(24).plus(windowBuffer);
        }
    }

    /**
     * 配額預設設定。
     *
     * @param anonymousLimit 匿名用戶配額，每日重置時還原為此值（config 未設定時），預設 10
     * @param resetHour 每日重置的預定小時 (UTC)，僅供參考，預設 0
     * @param cacheTtl 配額設定快取時間，預設 5 分鐘
     * @param tiers 各方案的週期上限，{@code -1} 表示無限制
     */
    public record LimitsConfig(
        int anonymousLimit,
        int resetHour,
        Duration cacheTtl,
        Map<String, TierLimits> tiers
    ) {
        public LimitsConfig {
            if (anonymousLimit <= 0) {
                anonymousLimit = 10;
            }
            if (resetHour < 0 || resetHour > 23) {
                resetHour = 0;
            }
            if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
                cacheTtl = Duration.ofMinutes(5);
            }
            if (tiers == null || tiers.isEmpty()) {
                tiers = defaultTiers();
            }
        }

        public static LimitsConfig defaults() {
            return new LimitsConfig(10, 0, Duration.ofMinutes(5), defaultTiers());
        }

        private static Map<String, TierLimits> defaultTiers() {
            return Map.of(
                "free", new TierLimits(10, 50, 200),
                "pro", new TierLimits(100, 500, 2000),
                "admin", new TierLimits(-1, -1, -1)
            );
        }
    }

    /**
     * 單一方案的週期上限。
     *
     * @param dailyLimit 每日上限，-1 表示無限制
     * @param weeklyLimit 每週上限，-1 表示無限制
     * @param monthlyLimit 每月上限，-1 表示無限制
     */
    public record TierLimits(
        int dailyLimit,
        int weeklyLimit,
        int monthlyLimit
    ) {}

    /**
     * 管理員設定。
     *
     * @param apiKeys 具備管理員權限的 API Key 清單
     */
    public record AdminConfig(
        List<String> apiKeys
    ) {
        public AdminConfig {
            if (apiKeys == null) {
                apiKeys = List.of();
            }
        }
    }
}
