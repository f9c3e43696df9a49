package io.tickwise.client.config;

import javax.inject.Inject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    private final ObjectMapper mapper;

    @Inject
    public ConfigFactory(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    public Config create()
    {
        return new Config(mapper, mapper.createObjectNode());
    }

    public Config fromJsonString(String json)
    {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        }
        catch (JsonProcessingException ex) {
            throw new ConfigException("Config is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        return Config.fromJsonNode(mapper, node);
    }
}
