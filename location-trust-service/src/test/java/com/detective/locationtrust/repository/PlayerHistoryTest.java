package com.detective.locationtrust.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.detective.locationtrust.TestLocations;
import com.detective.locationtrust.dto.LocationSample;

@DisplayName("PlayerHistory Tests")
class PlayerHistoryTest {

    private static LocationSample fixNumber(int n) {
        return TestLocations.fix(TestLocations.north(TestLocations.ORIGIN, n), 5.0);
    }

    @Test
    @DisplayName("should evict the oldest fix when full")
    void shouldEvictOldestWhenFull() {
        PlayerHistory history = new PlayerHistory(3, TestLocations.NOW);
        for (int i = 1; i <= 5; i++) {
            history.append(fixNumber(i), TestLocations.NOW);
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.recent(10)).containsExactly(fixNumber(3), fixNumber(4), fixNumber(5));
    }

    @Test
    @DisplayName("should return the latest fixes oldest first")
    void shouldReturnLatestOldestFirst() {
        PlayerHistory history = new PlayerHistory(10, TestLocations.NOW);
        for (int i = 1; i <= 4; i++) {
            history.append(fixNumber(i), TestLocations.NOW);
        }

        assertThat(history.recent(2)).containsExactly(fixNumber(3), fixNumber(4));
        assertThat(history.recent(0)).isEmpty();
        assertThat(history.recent(-1)).isEmpty();
    }

    @Test
    @DisplayName("should return previous fixes before appending the new one")
    void shouldReturnPreviousBeforeAppending() {
        PlayerHistory history = new PlayerHistory(10, TestLocations.NOW);
        history.append(fixNumber(1), TestLocations.NOW);

        List<LocationSample> previous =
                history.appendAndGetPrevious(fixNumber(2), 5, TestLocations.NOW.plusSeconds(1));

        assertThat(previous).containsExactly(fixNumber(1));
        assertThat(history.size()).isEqualTo(2);
        assertThat(history.lastTouched()).isEqualTo(TestLocations.NOW.plusSeconds(1));
    }

    @Test
    @DisplayName("should report idleness against a cutoff")
    void shouldReportIdleness() {
        PlayerHistory history = new PlayerHistory(10, TestLocations.NOW);

        assertThat(history.isIdleSince(TestLocations.NOW.plusSeconds(1))).isTrue();
        assertThat(history.isIdleSince(TestLocations.NOW)).isFalse();
    }

    @Test
    @DisplayName("should reject a capacity below one")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new PlayerHistory(0, TestLocations.NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
