package io.github.samzhu.quotakeeper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.NoSuchElementException;

import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import io.github.samzhu.quotakeeper.document.User;

@ExtendWith(MockitoExtension.class)
class UserPageCursorTest {

    @Mock
    private MongoTemplate mongoTemplate;

    private final EligibilityFilter filter = new EligibilityFilter();

    @Test
    void shouldPageByIdAfterLastSeen() {
        // Given
        when(mongoTemplate.find(any(Query.class), eq(User.class)))
            .thenReturn(List.of(user("u1"), user("u2")))
            .thenReturn(List.of(user("u3")));
        UserPageCursor cursor = new UserPageCursor(mongoTemplate, filter.criteria(), 2);

        // When
        List<User> first = cursor.next();
        List<User> second = cursor.next();

        // Then
        assertThat(first).extracting(User::id).containsExactly("u1", "u2");
        assertThat(second).extracting(User::id).containsExactly("u3");
        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.lastSeenId()).isEqualTo("u3");

        ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate, times(2)).find(queries.capture(), eq(User.class));

        Query firstQuery = queries.getAllValues().get(0);
        assertThat(firstQuery.getQueryObject()).containsKey("usageCount").doesNotContainKey("_id");
        assertThat(firstQuery.getLimit()).isEqualTo(2);
        assertThat(firstQuery.getSortObject()).containsEntry("_id", 1);

        Query secondQuery = queries.getAllValues().get(1);
        assertThat((Document) secondQuery.getQueryObject().get("_id")).containsEntry("$gt", "u2");
    }

    @Test
    void shouldStopAfterEmptyPageWhenLastPageWasFull() {
        // Given
        when(mongoTemplate.find(any(Query.class), eq(User.class)))
            .thenReturn(List.of(user("u1"), user("u2")))
            .thenReturn(List.of());
        UserPageCursor cursor = new UserPageCursor(mongoTemplate, filter.criteria(), 2);

        // When
        cursor.next();

        // Then
        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.hasNext()).isFalse();
        verify(mongoTemplate, times(2)).find(any(Query.class), eq(User.class));
    }

    @Test
    void shouldResumeFromGivenId() {
        // Given
        when(mongoTemplate.find(any(Query.class), eq(User.class))).thenReturn(List.of());
        UserPageCursor cursor = new UserPageCursor(mongoTemplate, filter.criteria(), 100, "u500");

        // When
        boolean hasNext = cursor.hasNext();

        // Then
        assertThat(hasNext).isFalse();
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(User.class));
        assertThat((Document) query.getValue().getQueryObject().get("_id")).containsEntry("$gt", "u500");
    }

    @Test
    void shouldThrowWhenExhausted() {
        when(mongoTemplate.find(any(Query.class), eq(User.class))).thenReturn(List.of());
        UserPageCursor cursor = new UserPageCursor(mongoTemplate, filter.criteria(), 10);

        assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void shouldRejectNonPositivePageSize() {
        assertThatThrownBy(() -> new UserPageCursor(mongoTemplate, filter.criteria(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static User user(String id) {
        return new User(id, 1L, 1, 1, 1, null, null, null, false, false, null, null);
    }
}
