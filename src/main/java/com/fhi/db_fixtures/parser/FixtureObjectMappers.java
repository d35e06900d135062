package com.fhi.db_fixtures.parser;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.slf4j.Slf4j;

/**
 * The {@link ObjectMapper}s used for fixtures.
 *
 * <p>These are deliberately not Spring beans: the host application's own {@code ObjectMapper}
 * is tuned for its HTTP layer and must not change how fixture files are read.</p>
 */
@Slf4j
public final class FixtureObjectMappers
{
    private FixtureObjectMappers()
    {}


    /**
     * Mapper for {@code .json} fixtures. Allows comments.
     */
    public static ObjectMapper json()
    {   return configure(new ObjectMapper());
    }


    /**
     * Mapper for {@code .yaml}/{@code .yml} fixtures.
     */
    public static ObjectMapper yaml()
    {   return configure(new ObjectMapper(new YAMLFactory()));
    }


    public static ObjectMapper forFormat(FixtureFormat format)
    {   return switch (format)
        {
            case JSON -> json();
            case YAML -> yaml();
        };
    }


    /**
     * Mapper used to copy record values onto model instances.
     *
     * <p>Supports {@code java.time} properties ({@code "2021-03-04"} into a {@code LocalDate}).
     * Record keys with no matching property are skipped; keys starting with {@code _}
     * silently, others with a warning.</p>
     */
    public static ObjectMapper model()
    {   return json().addHandler(new UnknownPropertyLogger());
    }


    private static ObjectMapper configure(ObjectMapper mapper)
    {
        return mapper
                .configure(JsonParser.Feature.ALLOW_COMMENTS, true)                      // // and /* */ comments in JSON
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)    // allows _comment fields etc.
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .registerModule(new JavaTimeModule());
    }


    private static final class UnknownPropertyLogger extends DeserializationProblemHandler
    {
        @Override
        public boolean handleUnknownProperty(DeserializationContext ctxt, JsonParser p,
                                             JsonDeserializer<?> deserializer, Object beanOrClass,
                                             String propertyName) throws IOException
        {
            if (!propertyName.startsWith("_"))
            {   Class<?> type = (beanOrClass instanceof Class) ? (Class<?>) beanOrClass : beanOrClass.getClass();
                log.warn("Ignoring fixture field '{}': no such property on {}", propertyName, type.getName());
            }
            p.skipChildren();
            return true;
        }
    }
}
