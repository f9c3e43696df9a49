package io.tickwise.standards.schedule;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleErrorKind;
import io.tickwise.spi.ScheduleException;

import java.time.Clock;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;

public class OneTimeSchedule
        implements Schedule
{
    private final Instant time;

    private OneTimeSchedule(Instant time)
    {
        this.time = time;
    }

    public static OneTimeSchedule of(Instant time)
    {
        return of(time, Clock.systemUTC());
    }

    public static OneTimeSchedule of(Instant time, Clock clock)
    {
        checkNotNull(time, "time");
        Instant now = clock.instant();
        if (!time.isAfter(now)) {
            throw new ScheduleException(ScheduleErrorKind.TIME_IN_PAST,
                    "one-time schedule at " + time + " is not after now (" + now + ")");
        }
        return new OneTimeSchedule(time);
    }

    public Instant getTime()
    {
        return time;
    }

    @Override
    public Optional<Instant> nextOccurrence(Instant after)
    {
        if (after.isBefore(time)) {
            return Optional.of(time);
        }
        else {
            return Optional.absent();
        }
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("time", time)
            .toString();
    }
}
