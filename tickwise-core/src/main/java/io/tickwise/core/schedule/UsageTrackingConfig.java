package io.tickwise.core.schedule;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import io.tickwise.client.config.Config;

/**
 * A copy of a schedule config that remembers which keys a factory looked at.
 */
class UsageTrackingConfig
    extends Config
{
    private final List<String> givenKeys;
    private final Set<String> readKeys = new LinkedHashSet<>();

    UsageTrackingConfig(Config config)
    {
        super(config);
        this.givenKeys = config.getKeys();
    }

    @Override
    protected JsonNode lookup(String key)
    {
        readKeys.add(key);
        return super.lookup(key);
    }

    @Override
    public boolean has(String key)
    {
        readKeys.add(key);
        return super.has(key);
    }

    // keys of the original config that nothing read
    List<String> getUnreadKeys()
    {
        ImmutableList.Builder<String> unread = ImmutableList.builder();
        for (String key : givenKeys) {
            if (!readKeys.contains(key)) {
                unread.add(key);
            }
        }
        return unread.build();
    }
}
