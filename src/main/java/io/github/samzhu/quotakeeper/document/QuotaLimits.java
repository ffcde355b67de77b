package io.github.samzhu.quotakeeper.document;

import java.time.Instant;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 配額政策設定文件（{@code config/limits}，單一文件）。
 *
 * <p>只有 {@link io.github.samzhu.quotakeeper.service.ConfigUpdater} 會寫入
 * {@code anonymousLimit} 與 {@code lastReset}。
 */
@Document(collection = "config")
public record QuotaLimits(
    @Id String id,

    /** 每日重置的預定小時 (UTC)，僅供參考，實際觸發由排程決定 */
    int resetHour,
    /** 匿名用戶配額上限，每日重置時還原 */
    int anonymousLimit,
    /** 最後一次每日重置完成時間 */
    Instant lastReset,
    /** 最後一次重置的種類 */
    String resetType,
    /** 各方案週期上限，key 為 free / pro / admin */
    Map<String, TierLimit> tiers,
    /** 文件最後更新時間 */
    Instant lastUpdated
) {

    /** 單一文件的固定 ID */
    public static final String DOCUMENT_ID = "limits";

    /**
     * 單一方案的週期上限，{@code -1} 表示無限制。
     */
    public record TierLimit(
        int dailyLimit,
        int weeklyLimit,
        int monthlyLimit
    ) {

        public boolean isUnlimited() {
            return dailyLimit == -1;
        }

        public int limitFor(ResetKind kind) {
            return switch (kind) {
                case DAILY -> dailyLimit;
                case WEEKLY -> weeklyLimit;
                case MONTHLY -> monthlyLimit;
            };
        }
    }
}
