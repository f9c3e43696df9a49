package io.tickwise.standards.schedule;

import com.google.inject.Inject;
import io.tickwise.client.config.Config;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleFactory;
import io.tickwise.spi.ScheduleResolver;

import java.time.Clock;
import java.time.Instant;

public class OneTimeScheduleFactory
        implements ScheduleFactory
{
    private final ScheduleConfigHelper configHelper;
    private final Clock clock;

    @Inject
    public OneTimeScheduleFactory(ScheduleConfigHelper configHelper, Clock clock)
    {
        this.configHelper = configHelper;
        this.clock = clock;
    }

    @Override
    public String getType()
    {
        return "once";
    }

    @Override
    public Schedule newSchedule(Config config, ScheduleResolver resolver)
    {
        String at = configHelper.getCommandOr(config, "at", String.class);
        Instant time = configHelper.parseInstant("at", at);
        return OneTimeSchedule.of(time, clock);
    }
}
