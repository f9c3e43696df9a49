package io.tickwise.spi;

import io.tickwise.client.config.Config;

public interface ScheduleFactory
{
    String getType();

    Schedule newSchedule(Config config, ScheduleResolver resolver);
}
