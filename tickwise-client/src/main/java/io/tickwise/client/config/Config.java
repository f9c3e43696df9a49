package io.tickwise.client.config;

import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static java.util.Locale.ENGLISH;

/**
 * Parameters of a schedule or a job as a JSON object.
 *
 * <p>
 * Values are converted with the ObjectMapper the config was created with. A missing key,
 * a null value where one is required, and a value of the wrong type are all reported as
 * {@link ConfigException} naming the key.
 * </p>
 */
public class Config
{
    private final ObjectMapper mapper;
    private final ObjectNode params;

    Config(ObjectMapper mapper, ObjectNode params)
    {
        this.mapper = mapper;
        this.params = params;
    }

    protected Config(Config source)
    {
        this(source.mapper, source.params.deepCopy());
    }

    // elements of getList(key, Config.class)
    @JsonCreator
    public static Config fromJsonNode(@JacksonInject ObjectMapper mapper, JsonNode node)
    {
        if (!node.isObject()) {
            throw new ConfigException("Expected an object but got " + sample(node));
        }
        return new Config(mapper, (ObjectNode) node);
    }

    public Config set(String key, Object value)
    {
        if (value == null) {
            return remove(key);
        }
        params.set(key, mapper.valueToTree(value));
        return this;
    }

    public Config remove(String key)
    {
        params.remove(key);
        return this;
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(params.fieldNames());
    }

    public boolean has(String key)
    {
        return params.has(key);
    }

    public <E> E get(String key, Class<E> type)
    {
        return convert(key, required(key), mapper.constructType(type));
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        JsonNode value = lookup(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of(convert(key, value, mapper.constructType(type)));
    }

    public <E> List<E> getList(String key, Class<E> elementType)
    {
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
        return convert(key, required(key), listType);
    }

    public Optional<Config> getOptionalNested(String key)
    {
        JsonNode value = lookup(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object but got " + describe(value));
        }
        return Optional.of(new Config(mapper, (ObjectNode) value));
    }

    /**
     * Returns the raw value of a key, or null if the key is not set.
     * Every getter reads through this method.
     */
    protected JsonNode lookup(String key)
    {
        return params.get(key);
    }

    private JsonNode required(String key)
    {
        JsonNode value = lookup(key);
        if (value == null || value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required");
        }
        return value;
    }

    private <E> E convert(String key, JsonNode value, JavaType type)
    {
        try {
            return mapper.readValue(mapper.treeAsTokens(value), type);
        }
        catch (Exception ex) {
            throw new ConfigException(
                    "Parameter '" + key + "' must be " + expected(type) + " but got " + describe(value), ex);
        }
    }

    private static String expected(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw == String.class) {
            return "a string";
        }
        if (raw == Integer.class || raw == int.class || raw == Long.class || raw == long.class) {
            return "an integer";
        }
        if (raw == Boolean.class || raw == boolean.class) {
            return "true or false";
        }
        if (type.isCollectionLikeType()) {
            return "an array";
        }
        if (raw == Config.class) {
            return "an object";
        }
        return raw.getSimpleName();
    }

    private static String describe(JsonNode value)
    {
        JsonNodeType nodeType = value.getNodeType();
        return sample(value) + " (" + nodeType.name().toLowerCase(ENGLISH) + ")";
    }

    private static String sample(JsonNode value)
    {
        String json = value.toString();
        return json.length() <= 80 ? json : json.substring(0, 77) + "...";
    }

    @Override
    public String toString()
    {
        return params.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof Config && params.equals(((Config) other).params);
    }

    @Override
    public int hashCode()
    {
        return params.hashCode();
    }
}
