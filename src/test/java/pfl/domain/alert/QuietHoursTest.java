package pfl.domain.alert;

import org.joda.time.DateTime;
import org.joda.time.Interval;
import org.joda.time.LocalTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for QuietHours
 * @since 19/01/2026
 */
class QuietHoursTest {

    private final QuietHours overnight = new QuietHours(true, new LocalTime(22, 0), new LocalTime(7, 0));

    @Test
    @DisplayName("Should wrap an overnight window over midnight")
    void shouldWrapOverMidnight() {
        assertThat(overnight.isActive(new LocalTime(23, 30))).isTrue();
        assertThat(overnight.isActive(new LocalTime(6, 30))).isTrue();
        assertThat(overnight.isActive(new LocalTime(12, 0))).isFalse();
    }

    @Test
    @DisplayName("Should include the start and exclude the end")
    void shouldHaveInclusiveStartExclusiveEnd() {
        assertThat(overnight.isActive(new LocalTime(22, 0))).isTrue();
        assertThat(overnight.isActive(new LocalTime(7, 0))).isFalse();
    }

    @Test
    @DisplayName("Should handle a window within one day")
    void shouldHandleDaytimeWindow() {
        QuietHours lunch = new QuietHours(true, new LocalTime(12, 0), new LocalTime(13, 0));

        assertThat(lunch.isActive(new LocalTime(12, 30))).isTrue();
        assertThat(lunch.isActive(new LocalTime(13, 30))).isFalse();
        assertThat(lunch.isActive(new LocalTime(11, 59))).isFalse();
    }

    @Test
    @DisplayName("Should never be active when disabled")
    void shouldBeInactiveWhenDisabled() {
        QuietHours disabled = new QuietHours(false, new LocalTime(22, 0), new LocalTime(7, 0));

        assertThat(disabled.isActive(new LocalTime(23, 30))).isFalse();
    }

    @Test
    @DisplayName("Should report the running period up to now during quiet hours")
    void shouldReportRunningPeriod() {
        // Given
        DateTime now = new DateTime(2026, 1, 21, 2, 15);

        // When
        Interval period = overnight.mostRecentPeriod(now);

        // Then
        assertThat(period.getStart()).isEqualTo(new DateTime(2026, 1, 20, 22, 0));
        assertThat(period.getEnd()).isEqualTo(now);
    }

    @Test
    @DisplayName("Should report last night's period during the day")
    void shouldReportLastPeriod() {
        // Given
        DateTime now = new DateTime(2026, 1, 21, 9, 0);

        // When
        Interval period = overnight.mostRecentPeriod(now);

        // Then
        assertThat(period.getStart()).isEqualTo(new DateTime(2026, 1, 20, 22, 0));
        assertThat(period.getEnd()).isEqualTo(new DateTime(2026, 1, 21, 7, 0));
    }
}
