package io.github.samzhu.quotakeeper.exception;

/**
 * 手動重置授權失敗異常。
 *
 * <p>呼叫者憑證未宣告管理員權限時拋出，不會執行任何寫入。
 */
public class ResetAuthorizationException extends RuntimeException {

    public static final String MESSAGE = "Unauthorized: Admin access required";

    private final String subject;

    public ResetAuthorizationException(String subject) {
        super(MESSAGE);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
