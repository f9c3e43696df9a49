package io.tickwise.standards.schedule;

import com.google.common.base.Optional;
import io.tickwise.client.config.Config;
import io.tickwise.client.config.ConfigException;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Reads the parameters shared by schedule and job configs.
 * Times are ISO-8601 instants such as {@code 2023-03-01T00:00:00Z}. Durations are whole seconds.
 */
public class ScheduleConfigHelper
{
    private static final String COMMAND_KEY = "_command";

    /**
     * Value of an operator key such as {@code "interval>": 3600}, which arrives as {@code _command},
     * or else the value of {@code key}.
     */
    public <E> E getCommandOr(Config config, String key, Class<E> type)
    {
        Optional<E> command = config.getOptional(COMMAND_KEY, type);
        if (command.isPresent()) {
            return command.get();
        }
        return config.get(key, type);
    }

    public Instant getInstant(Config config, String key)
    {
        return parseInstant(key, config.get(key, String.class));
    }

    public Optional<Instant> getOptionalInstant(Config config, String key)
    {
        Optional<String> value = config.getOptional(key, String.class);
        if (!value.isPresent()) {
            return Optional.absent();
        }
        return Optional.of(parseInstant(key, value.get()));
    }

    public Instant parseInstant(String key, String value)
    {
        try {
            return Instant.parse(value);
        }
        catch (DateTimeParseException ex) {
            throw new ConfigException("Parameter '" + key + "' must be an ISO-8601 instant such as 2023-03-01T00:00:00Z but got '" + value + "'", ex);
        }
    }

    public Duration getSeconds(Config config, String key)
    {
        return Duration.ofSeconds(config.get(key, long.class));
    }

    public void validateStartEnd(Optional<Instant> start, Optional<Instant> end)
    {
        if (start.isPresent() && end.isPresent() && !end.get().isAfter(start.get())) {
            throw new ConfigException("Parameter 'end' (" + end.get() + ") must be after 'start' (" + start.get() + ")");
        }
    }
}
