package io.github.samzhu.quotakeeper.dto;

import org.springframework.security.core.Authentication;

/**
 * 呼叫者憑證宣告，明確傳入手動重置，不依賴全域 session 狀態。
 *
 * @param subject 呼叫者識別
 * @param admin 是否具備管理員權限
 */
public record CallerClaims(
    String subject,
    boolean admin
) {

    /** 管理員 API Key 驗證後授予的權限 */
    public static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    public static CallerClaims anonymous() {
        return new CallerClaims("anonymous", false);
    }

    public static CallerClaims admin(String subject) {
        return new CallerClaims(subject, true);
    }

    /**
     * 由 Spring Security 驗證資訊建立憑證。
     *
     * @param authentication 目前請求的驗證資訊，可為 null
     * @return 呼叫者憑證，未驗證時為匿名非管理員
     */
    public static CallerClaims from(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            return anonymous();
        }
        boolean admin = authentication.getAuthorities().stream()
            .anyMatch(authority -> ADMIN_AUTHORITY.equals(authority.getAuthority()));
        return new CallerClaims(authentication.getName(), admin);
    }
}
