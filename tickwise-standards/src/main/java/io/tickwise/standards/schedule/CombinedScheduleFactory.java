package io.tickwise.standards.schedule;

import com.google.common.collect.ImmutableList;
import io.tickwise.client.config.Config;
import io.tickwise.client.config.ConfigException;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleFactory;
import io.tickwise.spi.ScheduleResolver;

import java.util.List;

public class CombinedScheduleFactory
        implements ScheduleFactory
{
    @Override
    public String getType()
    {
        return "combined";
    }

    @Override
    public Schedule newSchedule(Config config, ScheduleResolver resolver)
    {
        List<Config> nested = config.getList("schedules", Config.class);
        if (nested.isEmpty()) {
            throw new ConfigException("combined schedule requires at least one schedule in 'schedules'");
        }

        ImmutableList.Builder<Schedule> schedules = ImmutableList.builder();
        for (Config scheduleConfig : nested) {
            schedules.add(resolver.resolve(scheduleConfig));
        }
        return CombinedSchedule.of(schedules.build());
    }
}
