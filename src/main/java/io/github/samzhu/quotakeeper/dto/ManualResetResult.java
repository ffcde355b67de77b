package io.github.samzhu.quotakeeper.dto;

import java.util.List;

/**
 * 手動重置結果。
 *
 * <p>{@code all} 時只有三種重置全部 completed 才算成功；已成功的重置不會回滾，
 * 各種類的 {@code reset_logs} 紀錄才是實際結果。
 *
 * @param success 是否全部成功
 * @param message 結果訊息
 * @param outcomes 各種類的執行結果
 */
public record ManualResetResult(
    boolean success,
    String message,
    List<ResetOutcome> outcomes
) {}
