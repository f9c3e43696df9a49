package io.tickwise.standards.schedule;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleErrorKind;
import io.tickwise.spi.ScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.temporal.ChronoUnit;

import static java.time.ZoneOffset.UTC;

/**
 * Fires when a UTC calendar time matches every configured field.
 *
 * <p>
 * Fields are minute (0-59), hour (0-23), day of month (1-31), month (1-12) and weekday
 * (0-6, 0 is Monday). A field that is not set matches any value, so a schedule without
 * fields fires every second. Each setter returns a new schedule and rejects out-of-range
 * values. A day of month that the configured month never has (for example day 30 of
 * February) is rejected as well because no time could ever match it.
 * </p>
 *
 * <p>
 * When the minute is set, occurrences are always at second 0 of that minute.
 * </p>
 */
public class CronSchedule
        implements Schedule
{
    private static final Logger logger = LoggerFactory.getLogger(CronSchedule.class);

    private final Optional<Integer> minute;
    private final Optional<Integer> hour;
    private final Optional<Integer> day;
    private final Optional<Integer> month;
    private final Optional<Integer> weekday;

    private CronSchedule(Optional<Integer> minute, Optional<Integer> hour, Optional<Integer> day,
            Optional<Integer> month, Optional<Integer> weekday)
    {
        this.minute = minute;
        this.hour = hour;
        this.day = day;
        this.month = month;
        this.weekday = weekday;
    }

    public static CronSchedule everySecond()
    {
        return new CronSchedule(Optional.absent(), Optional.absent(), Optional.absent(), Optional.absent(), Optional.absent());
    }

    public CronSchedule minute(int minute)
    {
        checkRange("minute", minute, 0, 59);
        return new CronSchedule(Optional.of(minute), hour, day, month, weekday);
    }

    public CronSchedule hour(int hour)
    {
        checkRange("hour", hour, 0, 23);
        return new CronSchedule(minute, Optional.of(hour), day, month, weekday);
    }

    public CronSchedule day(int day)
    {
        checkRange("day", day, 1, 31);
        checkDayOfMonth(day, month);
        return new CronSchedule(minute, hour, Optional.of(day), month, weekday);
    }

    public CronSchedule month(int month)
    {
        checkRange("month", month, 1, 12);
        checkDayOfMonth(day, month);
        return new CronSchedule(minute, hour, day, Optional.of(month), weekday);
    }

    public CronSchedule weekday(int weekday)
    {
        checkRange("weekday", weekday, 0, 6);
        return new CronSchedule(minute, hour, day, month, Optional.of(weekday));
    }

    public Optional<Integer> getMinute()
    {
        return minute;
    }

    public Optional<Integer> getHour()
    {
        return hour;
    }

    public Optional<Integer> getDay()
    {
        return day;
    }

    public Optional<Integer> getMonth()
    {
        return month;
    }

    public Optional<Integer> getWeekday()
    {
        return weekday;
    }

    private static void checkRange(String field, int value, int min, int max)
    {
        if (value < min || max < value) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_CONFIGURATION,
                    field + " must be between " + min + " and " + max + ": " + value);
        }
    }

    private static void checkDayOfMonth(int day, Optional<Integer> month)
    {
        if (month.isPresent()) {
            checkDayOfMonth(Optional.of(day), month.get());
        }
    }

    private static void checkDayOfMonth(Optional<Integer> day, int month)
    {
        if (day.isPresent() && day.get() > Month.of(month).maxLength()) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_DATE_TIME,
                    "day " + day.get() + " never occurs in " + Month.of(month));
        }
    }

    @Override
    public Optional<Instant> nextOccurrence(Instant after)
    {
        try {
            return Optional.of(search(after));
        }
        catch (DateTimeException ex) {
            logger.debug("no occurrence of {} after {} within the supported date range", this, after);
            return Optional.absent();
        }
    }

    private Instant search(Instant after)
    {
        // +1s so that the result is always after the given time
        LocalDateTime next = LocalDateTime.ofEpochSecond(after.getEpochSecond(), 0, UTC).plusSeconds(1);

        // Each step moves the time forward and restarts from the month. Loop ends once all fields match.
        while (true) {
            if (month.isPresent()) {
                int current = next.getMonthValue();
                if (current < month.get()) {
                    next = LocalDate.of(next.getYear(), month.get(), 1).atStartOfDay();
                    continue;
                }
                else if (current > month.get()) {
                    next = LocalDate.of(next.getYear() + 1, 1, 1).atStartOfDay();
                    continue;
                }
            }

            if (day.isPresent()) {
                int current = next.getDayOfMonth();
                if (current < day.get()) {
                    // plusDays rolls into the next month if this month is shorter than the day
                    next = next.toLocalDate().withDayOfMonth(1).plusDays(day.get() - 1).atStartOfDay();
                    continue;
                }
                else if (current > day.get()) {
                    next = next.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                    continue;
                }
            }

            if (weekday.isPresent()) {
                // DayOfWeek is 1 (Monday) to 7 (Sunday)
                if (next.getDayOfWeek().getValue() - 1 != weekday.get()) {
                    next = next.toLocalDate().plusDays(1).atStartOfDay();
                    continue;
                }
            }

            if (hour.isPresent()) {
                int current = next.getHour();
                if (current < hour.get()) {
                    next = next.toLocalDate().atTime(hour.get(), 0);
                    continue;
                }
                else if (current > hour.get()) {
                    next = next.toLocalDate().plusDays(1).atStartOfDay();
                    continue;
                }
            }

            if (minute.isPresent()) {
                int current = next.getMinute();
                if (current < minute.get()) {
                    next = next.truncatedTo(ChronoUnit.HOURS).withMinute(minute.get());
                    continue;
                }
                else if (current > minute.get()) {
                    next = next.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                    continue;
                }
                else if (next.getSecond() != 0) {
                    next = next.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                    continue;
                }
            }

            return next.toInstant(UTC);
        }
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("minute", minute.orNull())
            .add("hour", hour.orNull())
            .add("day", day.orNull())
            .add("month", month.orNull())
            .add("weekday", weekday.orNull())
            .toString();
    }
}
