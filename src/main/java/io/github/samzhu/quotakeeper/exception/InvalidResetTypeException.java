package io.github.samzhu.quotakeeper.exception;

/**
 * 無效的重置類型異常。
 *
 * <p>手動觸發時 {@code resetType} 不是 daily / weekly / monthly / all 之一，
 * 在存取資料庫之前即拋出。
 */
public class InvalidResetTypeException extends RuntimeException {

    private final String resetType;

    public InvalidResetTypeException(String resetType) {
        super(String.format("Invalid reset type: '%s'. Expected one of daily, weekly, monthly, all", resetType));
        this.resetType = resetType;
    }

    public String getResetType() {
        return resetType;
    }
}
