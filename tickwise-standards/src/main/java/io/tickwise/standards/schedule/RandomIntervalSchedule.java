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
import java.util.Random;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Fires once at a random offset between a minimum and a maximum interval after an anchor.
 *
 * <p>
 * The anchor is the start time given by {@link #withStartTime(Instant)}, or the queried time if
 * no start time is set. The anchor never moves: every call of {@link #nextOccurrence(Instant)}
 * samples a new offset from the same anchor, so two calls with the same argument usually return
 * different times. Once the queried time passes the anchor, the returned time may be before the
 * queried time; a caller that wants a rolling random cadence builds a new schedule anchored at
 * the last fired time (see {@link #withStartTime(Instant)}).
 * </p>
 */
public class RandomIntervalSchedule
        implements Schedule
{
    private static final Logger logger = LoggerFactory.getLogger(RandomIntervalSchedule.class);

    private final Duration minInterval;
    private final Duration maxInterval;
    private final Optional<Instant> startTime;
    private final Optional<Instant> endTime;
    private final Random random;

    private RandomIntervalSchedule(Duration minInterval, Duration maxInterval,
            Optional<Instant> startTime, Optional<Instant> endTime, Random random)
    {
        this.minInterval = minInterval;
        this.maxInterval = maxInterval;
        this.startTime = startTime;
        this.endTime = endTime;
        this.random = random;
    }

    public static RandomIntervalSchedule of(Duration minInterval, Duration maxInterval)
    {
        checkNotNull(minInterval, "minInterval");
        checkNotNull(maxInterval, "maxInterval");
        if (!isWholePositiveSeconds(minInterval) || !isWholePositiveSeconds(maxInterval)) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_DURATION,
                    "random interval bounds must be positive numbers of whole seconds: " + minInterval + ", " + maxInterval);
        }
        if (minInterval.compareTo(maxInterval) > 0) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_CONFIGURATION,
                    "minimum interval " + minInterval + " is longer than maximum interval " + maxInterval);
        }
        return new RandomIntervalSchedule(minInterval, maxInterval, Optional.absent(), Optional.absent(), new Random());
    }

    private static boolean isWholePositiveSeconds(Duration duration)
    {
        return duration.getSeconds() > 0 && duration.getNano() == 0;
    }

    public RandomIntervalSchedule withStartTime(Instant startTime)
    {
        return new RandomIntervalSchedule(minInterval, maxInterval, Optional.of(startTime), endTime, random);
    }

    public RandomIntervalSchedule withEndTime(Instant endTime)
    {
        return new RandomIntervalSchedule(minInterval, maxInterval, startTime, Optional.of(endTime), random);
    }

    public RandomIntervalSchedule withRandom(Random random)
    {
        return new RandomIntervalSchedule(minInterval, maxInterval, startTime, endTime, checkNotNull(random, "random"));
    }

    public Duration getMinInterval()
    {
        return minInterval;
    }

    public Duration getMaxInterval()
    {
        return maxInterval;
    }

    public Optional<Instant> getStartTime()
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
        Instant anchor = startTime.or(after);
        Instant next;
        try {
            next = anchor.plus(randomInterval());
        }
        catch (DateTimeException ex) {
            logger.debug("sampled occurrence after {} is beyond the supported time range", anchor);
            return Optional.absent();
        }

        if (endTime.isPresent() && next.isAfter(endTime.get())) {
            logger.debug("sampled occurrence is after the end. next:{}, end:{}", next, endTime.get());
            return Optional.absent();
        }
        return Optional.of(next);
    }

    // uniform in [minInterval, maxInterval], both inclusive
    private Duration randomInterval()
    {
        long min = minInterval.getSeconds();
        long range = maxInterval.getSeconds() - min + 1;
        return Duration.ofSeconds(min + (long) (random.nextDouble() * range));
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("minInterval", minInterval)
            .add("maxInterval", maxInterval)
            .add("startTime", startTime.orNull())
            .add("endTime", endTime.orNull())
            .toString();
    }
}
