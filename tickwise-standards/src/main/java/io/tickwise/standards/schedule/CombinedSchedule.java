package io.tickwise.standards.schedule;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.tickwise.spi.Schedule;

import java.time.Instant;
import java.util.List;

/**
 * Fires whenever any of the component schedules fires.
 *
 * Useful for mixtures such as "every hour until 10pm, then every minute for an hour".
 */
public class CombinedSchedule
        implements Schedule
{
    private final List<Schedule> schedules;

    private CombinedSchedule(List<Schedule> schedules)
    {
        this.schedules = schedules;
    }

    public static CombinedSchedule of(List<? extends Schedule> schedules)
    {
        return new CombinedSchedule(ImmutableList.copyOf(schedules));
    }

    public static CombinedSchedule of(Schedule... schedules)
    {
        return new CombinedSchedule(ImmutableList.copyOf(schedules));
    }

    public List<Schedule> getSchedules()
    {
        return schedules;
    }

    @Override
    public Optional<Instant> nextOccurrence(Instant after)
    {
        Optional<Instant> earliest = Optional.absent();
        for (Schedule schedule : schedules) {
            Optional<Instant> next = schedule.nextOccurrence(after);
            if (next.isPresent() && (!earliest.isPresent() || next.get().isBefore(earliest.get()))) {
                earliest = next;
            }
        }
        return earliest;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("schedules", schedules)
            .toString();
    }
}
