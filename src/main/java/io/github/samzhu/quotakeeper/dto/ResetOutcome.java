package io.github.samzhu.quotakeeper.dto;

import io.github.samzhu.quotakeeper.document.ResetKind;
import io.github.samzhu.quotakeeper.document.ResetLog;

/**
 * 單次重置的執行結果。
 *
 * @param kind 重置種類
 * @param usersReset 已提交批次中重置的用戶數
 * @param batchesCommitted 已提交的批次數
 * @param status {@code completed} 或 {@code failed}
 * @param error 失敗原因，成功時為 null
 */
public record ResetOutcome(
    ResetKind kind,
    int usersReset,
    int batchesCommitted,
    String status,
    String error
) {

    public static ResetOutcome completed(ResetKind kind, int usersReset, int batchesCommitted) {
        return new ResetOutcome(kind, usersReset, batchesCommitted, ResetLog.STATUS_COMPLETED, null);
    }

    public static ResetOutcome failed(ResetKind kind, int usersReset, int batchesCommitted, String error) {
        return new ResetOutcome(kind, usersReset, batchesCommitted, ResetLog.STATUS_FAILED, error);
    }

    public boolean isCompleted() {
        return ResetLog.STATUS_COMPLETED.equals(status);
    }
}
