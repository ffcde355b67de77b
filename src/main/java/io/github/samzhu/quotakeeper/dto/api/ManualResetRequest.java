package io.github.samzhu.quotakeeper.dto.api;

/**
 * 手動重置請求。類型由 {@code ManualResetService} 在授權檢查之後驗證。
 *
 * @param resetType daily / weekly / monthly / all
 */
public record ManualResetRequest(
    String resetType
) {}
