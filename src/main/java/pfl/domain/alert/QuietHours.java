package pfl.domain.alert;

import org.joda.time.DateTime;
import org.joda.time.Interval;
import org.joda.time.LocalTime;
import pfl.dal.AlertConfig;

/**
 * Time-of-day window in which external channels stay silent. A window whose start is after its
 * end wraps over midnight (22:00-07:00). Start is inclusive, end exclusive.
 * @since 19/01/2026
 */
public class QuietHours {
    private final boolean enabled;
    private final LocalTime start;
    private final LocalTime end;

    public QuietHours(boolean enabled, LocalTime start, LocalTime end) {
        this.enabled = enabled;
        this.start = start;
        this.end = end;
    }

    public static QuietHours from(AlertConfig config) {
        return new QuietHours(config.quietHoursEnabled(), config.quietStart(), config.quietEnd());
    }

    public boolean isActive(LocalTime time) {
        if (!enabled || start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }

    public boolean isActive(DateTime at) {
        return isActive(at.toLocalTime());
    }

    /**
     * The quiet period running at {@code now} (up to now), or else the last one that ended before it
     */
    public Interval mostRecentPeriod(DateTime now) {
        if (isActive(now)) {
            DateTime startAt = now.withTime(start);
            if (startAt.isAfter(now)) {
                startAt = startAt.minusDays(1);
            }
            return new Interval(startAt, now);
        }
        DateTime endAt = now.withTime(end);
        if (endAt.isAfter(now)) {
            endAt = endAt.minusDays(1);
        }
        DateTime startAt = endAt.withTime(start);
        if (!startAt.isBefore(endAt)) {
            startAt = startAt.minusDays(1);
        }
        return new Interval(startAt, endAt);
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String toString() {
        return enabled ? "QuietHours{" + start + "-" + end + "}" : "QuietHours{disabled}";
    }
}
