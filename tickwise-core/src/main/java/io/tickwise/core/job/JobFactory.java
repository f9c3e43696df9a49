package io.tickwise.core.job;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.tickwise.client.config.Config;
import io.tickwise.client.config.ConfigException;
import io.tickwise.core.schedule.ScheduleManager;
import io.tickwise.spi.Schedule;
import io.tickwise.standards.schedule.ScheduleConfigHelper;

import java.time.Instant;

/**
 * Builds jobs from config such as:
 *
 * <pre>
 * {
 *   "schedule": {"interval>": 3600, "start": "2023-03-01T00:00:00Z"},
 *   "max_repeats": 10,
 *   "end_time": "2023-03-03T23:59:59Z"
 * }
 * </pre>
 */
public class JobFactory
{
    private final ScheduleManager scheduleManager;
    private final ScheduleConfigHelper configHelper;

    @Inject
    public JobFactory(ScheduleManager scheduleManager, ScheduleConfigHelper configHelper)
    {
        this.scheduleManager = scheduleManager;
        this.configHelper = configHelper;
    }

    public <T> Job<T> newJob(Config config, T task)
    {
        Optional<Schedule> schedule = scheduleManager.tryGetSchedule(config, "schedule");
        if (!schedule.isPresent()) {
            throw new ConfigException("Parameter 'schedule' is required");
        }

        JobBuilder<T> builder = Job.<T>builder()
            .schedule(schedule.get())
            .task(task);

        Optional<Integer> maxRepeats = config.getOptional("max_repeats", Integer.class);
        if (maxRepeats.isPresent()) {
            builder.maxRepeats(maxRepeats.get());
        }

        Optional<Instant> endTime = configHelper.getOptionalInstant(config, "end_time");
        if (endTime.isPresent()) {
            builder.endTime(endTime.get());
        }

        return builder.build();
    }
}
