package io.tickwise.client.config;

/**
 * A config parameter is missing, has the wrong type, or has a value that cannot be used.
 */
public class ConfigException
        extends RuntimeException
{
    public ConfigException(String message)
    {
        super(message);
    }

    public ConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
