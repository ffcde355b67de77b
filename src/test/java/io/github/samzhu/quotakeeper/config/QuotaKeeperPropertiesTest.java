package io.github.samzhu.quotakeeper.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class QuotaKeeperPropertiesTest {

    @Test
    void shouldApplyDefaultsForMissingSections() {
        QuotaKeeperProperties properties = new QuotaKeeperProperties(null, null, null, null, null);

        assertThat(properties.reset().batchSize()).isEqualTo(500);
        assertThat(properties.schedule().enabled()).isTrue();
        assertThat(properties.limits().anonymousLimit()).isEqualTo(10);
        assertThat(properties.limits().cacheTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.limits().tiers()).containsKeys("free", "pro", "admin");
        assertThat(properties.admin().apiKeys()).isEmpty();
    }

    @Test
    void shouldWidenDailyWindowByBuffer() {
        assertThat(QuotaKeeperProperties.HealthConfig.defaults().dailyWindow()).isEqualTo(Duration.ofHours(25));
        assertThat(new QuotaKeeperProperties.HealthConfig(Duration.ofMinutes(30)).dailyWindow())
            .isEqualTo(Duration.ofMinutes(24 * 60 + 30));
    }

    @Test
    void shouldReplaceInvalidBatchSize() {
        assertThat(new QuotaKeeperProperties.ResetConfig(0).batchSize()).isEqualTo(500);
        assertThat(new QuotaKeeperProperties.ResetConfig(200).batchSize()).isEqualTo(200);
    }
}
