package io.github.samzhu.quotakeeper.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import io.github.samzhu.quotakeeper.dto.CallerClaims;

/**
 * 管理員 API Key 驗證過濾器。
 *
 * <p>從 {@code Authorization: Bearer <key>} 取出 Key，與 {@code quota-keeper.admin.api-keys}
 * 以固定時間比較；相符時以 {@link CallerClaims#ADMIN_AUTHORITY} 建立 {@link SecurityContextHolder} 驗證資訊。
 * 不相符或未帶 Key 時不設定驗證資訊，由 {@code SecurityConfig} 的授權規則拒絕。
 *
 * <p>驗證主體為遮罩後的 Key（前 4 碼 + {@code ****}），可安全寫入日誌與重置紀錄。
 */
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final List<byte[]> adminKeys;

    public ApiKeyAuthenticationFilter(List<String> adminKeys) {
        this.adminKeys = adminKeys.stream()
            .filter(StringUtils::hasText)
            .map(key -> key.getBytes(StandardCharsets.UTF_8))
            .toList();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String apiKey = extractApiKey(request);
        if (apiKey != null) {
            if (isAdminKey(apiKey)) {
                var auth = new UsernamePasswordAuthenticationToken(
                    "api-key:" + mask(apiKey), null,
                    List.of(new SimpleGrantedAuthority(CallerClaims.ADMIN_AUTHORITY)));
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("Admin API key authenticated: {}", auth.getName());
            } else {
                log.debug("Unrecognized API key {} on {}", mask(apiKey), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private boolean isAdminKey(String apiKey) {
        byte[] presented = apiKey.getBytes(StandardCharsets.UTF_8);
        boolean matched = false;
        for (byte[] key : adminKeys) {
            matched |= MessageDigest.isEqual(presented, key);
        }
        return matched;
    }

    private static String extractApiKey(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(header) && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    static String mask(String token) {
        return token.length() <= 4 ? "****" : token.substring(0, 4) + "****";
    }
}
