package io.tickwise.core.job;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import io.tickwise.spi.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * A task bound to a schedule, with an optional repeat limit and expiry time.
 *
 * <p>
 * The owner drives time: it calls {@link #shouldExecute(Instant)} with the current time and runs
 * the returned task when one is returned. A job never runs the task itself.
 * </p>
 *
 * <p>
 * A job is not thread-safe. {@link #shouldExecute(Instant)} updates the repeat count, so a job
 * must be confined to one thread or guarded by the caller.
 * </p>
 */
public class Job<T>
{
    private static final Logger logger = LoggerFactory.getLogger(Job.class);

    /**
     * How far back the schedule is probed by {@link #shouldExecute(Instant)}.
     *
     * Schedules return occurrences strictly after the probed time. Probing one second before the
     * current time lets an occurrence exactly at the current time be recognized.
     */
    public static final Duration PROBE_EPSILON = Duration.ofSeconds(1);

    private final Schedule schedule;
    private final T task;
    private final Optional<Integer> maxRepeats;
    private final Optional<Instant> endTime;
    private final Duration probeEpsilon;
    private int repeats;

    Job(Schedule schedule, T task, Optional<Integer> maxRepeats, Optional<Instant> endTime, Duration probeEpsilon)
    {
        this.schedule = schedule;
        this.task = task;
        this.maxRepeats = maxRepeats;
        this.endTime = endTime;
        this.probeEpsilon = probeEpsilon;
        this.repeats = 0;
    }

    public static <T> JobBuilder<T> builder()
    {
        return new JobBuilder<>();
    }

    public Optional<T> shouldExecute(Instant currentTime)
    {
        if (isRepeatLimitReached()) {
            logger.debug("Job reached repeat limit {}: {}", maxRepeats.get(), task);
            return Optional.absent();
        }

        if (isEnded(currentTime)) {
            logger.debug("Job ended at {} (current time {}): {}", endTime.get(), currentTime, task);
            return Optional.absent();
        }

        Optional<Instant> next = schedule.nextOccurrence(probeTime(currentTime));
        if (next.isPresent() && !next.get().isAfter(currentTime)) {
            repeats++;
            logger.debug("Job fires at {} (repeat {}): {}", currentTime, repeats, task);
            return Optional.of(task);
        }

        return Optional.absent();
    }

    // clamped so that probing near Instant.MIN stays within the supported range
    private Instant probeTime(Instant currentTime)
    {
        if (currentTime.isBefore(Instant.MIN.plus(probeEpsilon))) {
            return Instant.MIN;
        }
        return currentTime.minus(probeEpsilon);
    }

    public boolean isExhausted(Instant currentTime)
    {
        return isRepeatLimitReached() || isEnded(currentTime);
    }

    private boolean isRepeatLimitReached()
    {
        return maxRepeats.isPresent() && repeats >= maxRepeats.get();
    }

    private boolean isEnded(Instant currentTime)
    {
        return endTime.isPresent() && !currentTime.isBefore(endTime.get());
    }

    public JobStatus getStatus(Instant currentTime)
    {
        boolean exhausted = isExhausted(currentTime);
        Optional<Instant> next = exhausted ? Optional.absent() : schedule.nextOccurrence(currentTime);
        return JobStatus.of(repeats, maxRepeats, endTime, next, exhausted);
    }

    public Schedule getSchedule()
    {
        return schedule;
    }

    public T getTask()
    {
        return task;
    }

    public int getRepeats()
    {
        return repeats;
    }

    public Optional<Integer> getMaxRepeats()
    {
        return maxRepeats;
    }

    public Optional<Instant> getEndTime()
    {
        return endTime;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("schedule", schedule)
            .add("task", task)
            .add("repeats", repeats)
            .add("maxRepeats", maxRepeats.orNull())
            .add("endTime", endTime.orNull())
            .toString();
    }
}
