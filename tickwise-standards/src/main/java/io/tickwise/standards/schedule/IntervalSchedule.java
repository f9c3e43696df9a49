package io.tickwise.standards.schedule;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleErrorKind;
import io.tickwise.spi.ScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;

public class IntervalSchedule
        implements Schedule
{
    private static final Logger logger = LoggerFactory.getLogger(IntervalSchedule.class);

    private final Duration interval;
    private final Instant startTime;
    private final Optional<Instant> endTime;

    private IntervalSchedule(Duration interval, Instant startTime, Optional<Instant> endTime)
    {
        this.interval = interval;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public static IntervalSchedule of(Duration interval, Instant startTime)
    {
        checkNotNull(interval, "interval");
        checkNotNull(startTime, "startTime");
        if (interval.getSeconds() <= 0 || interval.getNano() != 0) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_DURATION,
                    "interval must be a positive number of whole seconds: " + interval);
        }
        return new IntervalSchedule(interval, startTime, Optional.absent());
    }

    public IntervalSchedule withEndTime(Instant endTime)
    {
        return new IntervalSchedule(interval, startTime, Optional.of(endTime));
    }

    public Duration getInterval()
    {
        return interval;
    }

    public Instant getStartTime()
    {
        return startTime;
    }

    public Optional<Instant> getEndTime()
    {
        return endTime;
    }

    @Override
    public Optional<Instant> nextOccurrence(Instant after)
    {
        if (after.isBefore(startTime)) {
            return Optional.of(startTime);
        }

        long intervalsPassed = Duration.between(startTime, after).dividedBy(interval);
        Instant next;
        try {
            next = startTime.plus(interval.multipliedBy(intervalsPassed + 1));
        }
        catch (DateTimeException | ArithmeticException ex) {
            logger.debug("next occurrence after {} is beyond the supported time range", after);
            return Optional.absent();
        }

        if (endTime.isPresent() && next.isAfter(endTime.get())) {
            logger.debug("next occurrence is after the end. next:{}, end:{}", next, endTime.get());
            return Optional.absent();
        }
        return Optional.of(next);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("interval", interval)
            .add("startTime", startTime)
            .add("endTime", endTime.orNull())
            .toString();
    }
}
