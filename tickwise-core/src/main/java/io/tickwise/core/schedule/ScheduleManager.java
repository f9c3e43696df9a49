package io.tickwise.core.schedule;

import java.util.Map;
import java.util.Set;

import com.google.inject.Inject;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.tickwise.client.config.Config;
import io.tickwise.client.config.ConfigException;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleFactory;
import io.tickwise.spi.ScheduleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds schedules from config using the registered {@link ScheduleFactory} of each type.
 *
 * <p>
 * The type is either given as {@code "_type": "cron"} or as an operator key such as
 * {@code "interval>": 3600}. The operator form is rewritten to {@code _type} and
 * {@code _command} before the factory sees the config.
 * </p>
 */
public class ScheduleManager
        implements ScheduleResolver
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleManager.class);

    private static final String TYPE_KEY = "_type";
    private static final String COMMAND_KEY = "_command";

    private final Map<String, ScheduleFactory> factories;

    @Inject
    public ScheduleManager(Set<ScheduleFactory> factories)
    {
        ImmutableMap.Builder<String, ScheduleFactory> byType = ImmutableMap.builder();
        for (ScheduleFactory factory : factories) {
            byType.put(factory.getType(), factory);
        }
        this.factories = byType.build();
    }

    public Set<String> getTypes()
    {
        return factories.keySet();
    }

    public Optional<Schedule> tryGetSchedule(Config config, String key)
    {
        return config.getOptionalNested(key).transform(this::resolve);
    }

    @Override
    public Schedule resolve(Config scheduleConfig)
    {
        UsageTrackingConfig config = new UsageTrackingConfig(scheduleConfig);
        String type = resolveType(config);

        ScheduleFactory factory = factories.get(type);
        if (factory == null) {
            throw new ConfigException("Unknown schedule type '" + type + "'. Known types: " + factories.keySet());
        }

        Schedule schedule = factory.newSchedule(config, this);

        for (String key : config.getUnreadKeys()) {
            logger.warn("Parameter '{}' is not used by {} schedule", key, type);
        }
        logger.debug("Built {} schedule: {}", type, schedule);
        return schedule;
    }

    private static String resolveType(UsageTrackingConfig config)
    {
        if (config.has(TYPE_KEY)) {
            return config.get(TYPE_KEY, String.class);
        }

        for (String key : config.getKeys()) {
            if (key.endsWith(">")) {
                String type = key.substring(0, key.length() - 1);
                config.set(COMMAND_KEY, config.get(key, Object.class));
                config.set(TYPE_KEY, type);
                return type;
            }
        }
        throw new ConfigException("Schedule config needs '_type' or an operator key such as 'cron>': " + config);
    }
}
