package io.github.samzhu.quotakeeper.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>Repository 自動掃描 {@code io.github.samzhu.quotakeeper.repository} 下的介面。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code users} - 用戶用量計數器</li>
 *   <li>{@code config} - 配額設定（單一文件 {@code limits}）</li>
 *   <li>{@code reset_logs} - 重置執行紀錄（依 {@code kind} 分區）</li>
 *   <li>{@code health_alerts} - 健康檢查告警</li>
 *   <li>{@code health_status} - 最新健康狀態（單一文件 {@code latest}）</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.quotakeeper.repository")
public class MongoConfig {
}
