package io.github.samzhu.quotakeeper.dto.api;

import io.github.samzhu.quotakeeper.dto.ManualResetResult;

/**
 * 手動重置 API 回應。
 */
public record ManualResetResponse(
    boolean success,
    String message
) {

    public static ManualResetResponse from(ManualResetResult result) {
        return new ManualResetResponse(result.success(), result.message());
    }
}
