package io.github.samzhu.quotakeeper.security;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.quotakeeper.exception.ResetAuthorizationException;

/**
 * 管理端點拒絕存取時的回應，格式與 {@code GlobalExceptionHandler} 相同：
 * {@code 403 {error, status, timestamp}}。
 *
 * <p>未帶 Key 與 Key 不具管理員權限一律回應 403，與手動重置的授權錯誤一致。
 */
public class AdminAccessErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(AdminAccessErrorHandler.class);

    private final ObjectMapper objectMapper;

    public AdminAccessErrorHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        reject(request, response);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        reject(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response) throws IOException {
        log.warn("Admin endpoint rejected: {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), Map.of(
            "error", ResetAuthorizationException.MESSAGE,
            "status", HttpStatus.FORBIDDEN.value(),
            "timestamp", OffsetDateTime.now().toString()
        ));
    }
}
