package io.tickwise.standards.schedule;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.tickwise.client.config.Config;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleFactory;
import io.tickwise.spi.ScheduleResolver;

import java.time.Instant;
import java.util.Random;

public class RandomIntervalScheduleFactory
        implements ScheduleFactory
{
    private final ScheduleConfigHelper configHelper;

    @Inject
    public RandomIntervalScheduleFactory(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public String getType()
    {
        return "random_interval";
    }

    @Override
    public Schedule newSchedule(Config config, ScheduleResolver resolver)
    {
        Optional<Instant> start = configHelper.getOptionalInstant(config, "start");
        Optional<Instant> end = configHelper.getOptionalInstant(config, "end");
        configHelper.validateStartEnd(start, end);
        Optional<Long> seed = config.getOptional("seed", Long.class);

        RandomIntervalSchedule schedule = RandomIntervalSchedule.of(
                configHelper.getSeconds(config, "min"),
                configHelper.getSeconds(config, "max"));
        if (start.isPresent()) {
            schedule = schedule.withStartTime(start.get());
        }
        if (end.isPresent()) {
            schedule = schedule.withEndTime(end.get());
        }
        if (seed.isPresent()) {
            schedule = schedule.withRandom(new Random(seed.get()));
        }
        return schedule;
    }
}
