package com.heroku.relay.services;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventDeduplicationCache Tests")
class EventDeduplicationCacheTest {

    @Test
    @DisplayName("Should report an id as new the first time and as a duplicate afterwards")
    void shouldDetectDuplicates() {
        EventDeduplicationCache cache = new EventDeduplicationCache(1000);

        assertThat(cache.seen("42")).isFalse();
        assertThat(cache.seen("42")).isTrue();
        assertThat(cache.seen("43")).isFalse();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should clear everything before recording the id that would exceed capacity")
    void shouldResetWhenFull() {
        EventDeduplicationCache cache = new EventDeduplicationCache(3);
        cache.seen("a");
        cache.seen("b");
        cache.seen("c");
        assertThat(cache.size()).isEqualTo(3);

        // When
        boolean duplicate = cache.seen("d");

        // Then
        assertThat(duplicate).isFalse();
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.seen("d")).isTrue();
    }

    @Test
    @DisplayName("Should let an old id through again only after a reset")
    void shouldForgetHistoryOnReset() {
        EventDeduplicationCache cache = new EventDeduplicationCache(3);
        cache.seen("a");
        cache.seen("b");
        cache.seen("c");

        assertThat(cache.seen("a")).isTrue();

        cache.seen("d");
        assertThat(cache.seen("a")).isFalse();
    }

    @Test
    @DisplayName("Should never grow beyond its capacity")
    void shouldStayBounded() {
        EventDeduplicationCache cache = new EventDeduplicationCache(10);
        for (int i = 0; i < 95; i++) {
            cache.seen("event-" + i);
            assertThat(cache.size()).isLessThanOrEqualTo(10);
        }
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new EventDeduplicationCache(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
