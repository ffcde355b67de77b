package io.github.samzhu.quotakeeper.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 重置執行紀錄文件，只新增、不修改。
 *
 * <p>依 {@code kind} 分區（daily / weekly / monthly）。成功與失敗的執行都會留下一筆，
 * 失敗紀錄帶有 {@code error}，並保留失敗前已提交的用戶數。
 *
 * <p>同一種類重複執行會產生多筆紀錄；重置結果冪等，但紀錄不冪等。
 */
@Document(collection = "reset_logs")
@CompoundIndex(name = "kind_status_timestamp_idx", def = "{'kind': 1, 'status': 1, 'timestamp': -1}")
public record ResetLog(
    @Id String id,

    /** 重置種類 (daily / weekly / monthly) */
    String kind,
    /** 執行結束時間 */
    Instant timestamp,
    /** 實際重置的用戶數（已提交批次中的用戶） */
    int usersReset,
    /** 已提交的批次數 */
    int batchesCommitted,
    /** completed / failed */
    String status,
    /** 每日重置還原後的匿名配額，其他種類為 null */
    Integer anonymousLimitReset,
    /** scheduled / manual */
    String trigger,
    /** 失敗原因 */
    String error
) {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_MANUAL = "manual";

    public static ResetLog completed(ResetKind kind, Instant timestamp, int usersReset,
            int batchesCommitted, Integer anonymousLimitReset, String trigger) {
        return new ResetLog(null, kind.value(), timestamp, usersReset, batchesCommitted,
            STATUS_COMPLETED, anonymousLimitReset, trigger, null);
    }

    public static ResetLog failed(ResetKind kind, Instant timestamp, int usersReset,
            int batchesCommitted, String trigger, String error) {
        return new ResetLog(null, kind.value(), timestamp, usersReset, batchesCommitted,
            STATUS_FAILED, null, trigger, error);
    }

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
