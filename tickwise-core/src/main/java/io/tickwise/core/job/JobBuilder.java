package io.tickwise.core.job;

import com.google.common.base.Optional;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleErrorKind;
import io.tickwise.spi.ScheduleException;

import java.time.Duration;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;

public class JobBuilder<T>
{
    private Schedule schedule;
    private T task;
    private Optional<Integer> maxRepeats = Optional.absent();
    private Optional<Instant> endTime = Optional.absent();
    private Duration probeEpsilon = Job.PROBE_EPSILON;

    JobBuilder()
    { }

    public JobBuilder<T> schedule(Schedule schedule)
    {
        this.schedule = schedule;
        return this;
    }

    public JobBuilder<T> task(T task)
    {
        this.task = task;
        return this;
    }

    public JobBuilder<T> maxRepeats(int maxRepeats)
    {
        if (maxRepeats < 0) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_REPETITION,
                    "max repeats must not be negative: " + maxRepeats);
        }
        this.maxRepeats = Optional.of(maxRepeats);
        return this;
    }

    public JobBuilder<T> endTime(Instant endTime)
    {
        this.endTime = Optional.of(checkNotNull(endTime, "endTime"));
        return this;
    }

    // only schedules finer than a second need a smaller value
    public JobBuilder<T> probeEpsilon(Duration probeEpsilon)
    {
        checkNotNull(probeEpsilon, "probeEpsilon");
        if (probeEpsilon.isZero() || probeEpsilon.isNegative()) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_DURATION,
                    "probe epsilon must be positive: " + probeEpsilon);
        }
        this.probeEpsilon = probeEpsilon;
        return this;
    }

    public Job<T> build()
    {
        if (schedule == null) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_CONFIGURATION, "job requires a schedule");
        }
        if (task == null) {
            throw new ScheduleException(ScheduleErrorKind.INVALID_CONFIGURATION, "job requires a task");
        }
        return new Job<>(schedule, task, maxRepeats, endTime, probeEpsilon);
    }
}
