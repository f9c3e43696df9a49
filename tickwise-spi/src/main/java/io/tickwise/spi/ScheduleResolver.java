package io.tickwise.spi;

import io.tickwise.client.config.Config;

/**
 * Builds a schedule from a nested schedule config.
 *
 * Given to each {@link ScheduleFactory} so that composite schedules can build their components
 * without knowing which factories are registered.
 */
public interface ScheduleResolver
{
    Schedule resolve(Config scheduleConfig);
}
