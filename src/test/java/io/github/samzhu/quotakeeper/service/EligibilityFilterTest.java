package io.github.samzhu.quotakeeper.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import io.github.samzhu.quotakeeper.document.User;

class EligibilityFilterTest {

    private final EligibilityFilter filter = new EligibilityFilter();

    @Test
    void shouldKeepOnlyTrackedUsersInOrder() {
        // Given
        User a = tracked("a", 0L);
        User b = User.untracked("b");
        User c = tracked("c", 17L);

        // When
        List<User> eligible = filter.filter(List.of(a, b, c));

        // Then
        assertThat(eligible).containsExactly(a, c);
    }

    @Test
    void shouldTreatZeroUsageCountAsTracked() {
        assertThat(filter.isEligible(tracked("a", 0L))).isTrue();
        assertThat(filter.isEligible(User.untracked("b"))).isFalse();
        assertThat(filter.isEligible(null)).isFalse();
    }

    @Test
    void shouldReturnEmptyForEmptySnapshot() {
        assertThat(filter.filter(List.of())).isEmpty();
    }

    @Test
    void shouldBuildServerSideCriteria() {
        Document criteria = filter.criteria().getCriteriaObject();

        Document usageCount = (Document) criteria.get("usageCount");
        assertThat(usageCount).containsEntry("$exists", true).containsKey("$ne");
        assertThat(usageCount.get("$ne")).isNull();
    }

    private static User tracked(String id, long usageCount) {
        return new User(id, usageCount, 1, 1, 1, null, null, null, false, false, null, null);
    }
}
