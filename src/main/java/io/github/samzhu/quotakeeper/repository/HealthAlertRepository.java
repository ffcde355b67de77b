package io.github.samzhu.quotakeeper.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotakeeper.document.HealthAlert;

/**
 * 健康檢查告警資料存取介面。
 */
public interface HealthAlertRepository extends MongoRepository<HealthAlert, String> {

    List<HealthAlert> findAllByOrderByTimestampDesc(Pageable pageable);

    List<HealthAlert> findBySeverityOrderByTimestampDesc(String severity, Pageable pageable);
}
