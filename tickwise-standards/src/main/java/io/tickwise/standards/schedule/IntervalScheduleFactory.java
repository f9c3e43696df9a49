package io.tickwise.standards.schedule;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.tickwise.client.config.Config;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleFactory;
import io.tickwise.spi.ScheduleResolver;

import java.time.Duration;
import java.time.Instant;

public class IntervalScheduleFactory
        implements ScheduleFactory
{
    private final ScheduleConfigHelper configHelper;

    @Inject
    public IntervalScheduleFactory(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public String getType()
    {
        return "interval";
    }

    @Override
    public Schedule newSchedule(Config config, ScheduleResolver resolver)
    {
        Duration interval = Duration.ofSeconds(configHelper.getCommandOr(config, "interval", Long.class));
        Instant start = configHelper.getInstant(config, "start");
        Optional<Instant> end = configHelper.getOptionalInstant(config, "end");
        configHelper.validateStartEnd(Optional.of(start), end);

        IntervalSchedule schedule = IntervalSchedule.of(interval, start);
        return end.isPresent() ? schedule.withEndTime(end.get()) : schedule;
    }
}
