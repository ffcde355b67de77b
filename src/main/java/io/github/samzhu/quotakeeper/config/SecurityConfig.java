package io.github.samzhu.quotakeeper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.quotakeeper.security.AdminAccessErrorHandler;
import io.github.samzhu.quotakeeper.security.ApiKeyAuthenticationFilter;

/**
 * Spring Security 配置。
 *
 * <p>存取規則：
 * <ul>
 *   <li>{@code /api/v1/admin/**} - 需管理員 API Key（{@code ROLE_ADMIN}），否則回應 403</li>
 *   <li>其餘端點（用量查詢）- 不需驗證</li>
 * </ul>
 *
 * <p>無狀態 API：停用 CSRF 與 session，每個請求由 {@link ApiKeyAuthenticationFilter} 重新驗證。
 * 過濾器不註冊為 bean，避免同時被加入 servlet filter chain。
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    static final String ADMIN_PATHS = "/api/v1/admin/**";

    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            QuotaKeeperProperties properties,
            ObjectMapper objectMapper) throws Exception {

        AdminAccessErrorHandler errorHandler = new AdminAccessErrorHandler(objectMapper);

        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(ADMIN_PATHS).hasRole("ADMIN")
                .anyRequest().permitAll())
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(errorHandler)
                .accessDeniedHandler(errorHandler))
            .addFilterBefore(
                new ApiKeyAuthenticationFilter(properties.admin().apiKeys()),
                UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
