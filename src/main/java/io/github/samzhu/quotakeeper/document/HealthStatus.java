package io.github.samzhu.quotakeeper.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 最新健康狀態摘要（{@code health_status/latest}，單一文件，每次檢查覆寫）。
 *
 * <p>{@code next*} 欄位為純日曆推算的預期觸發時間，實際觸發由排程決定。
 */
@Document(collection = "health_status")
public record HealthStatus(
    @Id String id,
    Instant lastHealthCheck,
    /** healthy / warning */
    String status,
    /** 最近一次完成的每日重置，查無時為 null */
    Instant lastDailyReset,
    Instant nextDailyReset,
    Instant nextWeeklyReset,
    Instant nextMonthlyReset
) {

    public static final String DOCUMENT_ID = "latest";

    public static final String STATUS_HEALTHY = "healthy";
    public static final String STATUS_WARNING = "warning";
}
