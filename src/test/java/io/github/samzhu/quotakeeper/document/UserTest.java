package io.github.samzhu.quotakeeper.document;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UserTest {

    @Test
    void shouldResolveTier() {
        assertThat(user(false, false).tier()).isEqualTo("free");
        assertThat(user(true, false).tier()).isEqualTo("pro");
        // admin 優先於 pro
        assertThat(user(true, true).tier()).isEqualTo("admin");
    }

    @Test
    void shouldReadUsageByKind() {
        User user = new User("u", 10L, 1, 2, 3, null, null, null, false, false, null, null);

        assertThat(user.usageFor(ResetKind.DAILY)).isEqualTo(1);
        assertThat(user.usageFor(ResetKind.WEEKLY)).isEqualTo(2);
        assertThat(user.usageFor(ResetKind.MONTHLY)).isEqualTo(3);
    }

    @Test
    void shouldNotTrackNewUser() {
        User user = User.untracked("u");

        assertThat(user.isTracked()).isFalse();
        assertThat(user.tier()).isEqualTo("free");
    }

    private static User user(boolean pro, boolean admin) {
        return new User("u", 0L, 0, 0, 0, null, null, null, pro, admin, null, null);
    }
}
