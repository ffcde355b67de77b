package io.github.samzhu.quotakeeper.dto;

import java.time.Instant;

/**
 * 分析用量事件資料（CloudEvents data payload）。
 *
 * <p>分析後端每完成一次圖片分析請求發送一筆，Quota Keeper 消費後原子累加該用戶的用量計數。
 *
 * <p>欄位說明：
 * <ul>
 *   <li>{@code userId} - 用戶識別碼（匿名用戶為匿名 UID）</li>
 *   <li>{@code eventTime} - 分析完成時間 (UTC)，缺少時以接收時間代替</li>
 *   <li>{@code engine} - 使用的分析引擎</li>
 *   <li>{@code imageCount} - 本次分析的圖片數</li>
 *   <li>{@code status} - success / error，只有 success 會計入用量</li>
 * </ul>
 */
public record AnalysisUsageEvent(
    String userId,
    Instant eventTime,
    String engine,
    int imageCount,
    String status
) {

    /**
     * 判斷分析是否成功（不分大小寫）。
     *
     * @return true 表示成功
     */
    public boolean isSuccess() {
        return "success".equalsIgnoreCase(status);
    }
}
