package io.tickwise.standards.schedule;

import io.tickwise.spi.Schedule;

import java.time.Duration;
import java.time.Instant;

public final class Schedules
{
    private Schedules()
    { }

    public static OneTimeSchedule once(Instant time)
    {
        return OneTimeSchedule.of(time);
    }

    public static IntervalSchedule every(Duration interval, Instant startTime)
    {
        return IntervalSchedule.of(interval, startTime);
    }

    public static IntervalSchedule hourly(Instant startTime)
    {
        return IntervalSchedule.of(Duration.ofHours(1), startTime);
    }

    public static CronSchedule daily(int hour, int minute)
    {
        return CronSchedule.everySecond().hour(hour).minute(minute);
    }

    // weekday: 0 is Monday
    public static CronSchedule weekly(int weekday, int hour, int minute)
    {
        return daily(hour, minute).weekday(weekday);
    }

    public static CronSchedule monthly(int day, int hour, int minute)
    {
        return daily(hour, minute).day(day);
    }

    public static RandomIntervalSchedule between(Duration minInterval, Duration maxInterval, Instant startTime)
    {
        return RandomIntervalSchedule.of(minInterval, maxInterval).withStartTime(startTime);
    }

    public static CombinedSchedule combine(Schedule... schedules)
    {
        return CombinedSchedule.of(schedules);
    }
}
