package org.janelia.indexation.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;

/**
 * Utilities for working with JSON data.
 *
 * Libraries, parameters and crystal map entries are all mapped through their fields
 * so that derived convenience getters never leak into (or break) the JSON model.
 *
 * @author Eric Trautman
 */
public class JsonUtils {

    public static DefaultPrettyPrinter getArraysOnNewLinePrettyPrinter() {
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        return printer;
    }

    public static final ObjectMapper FAST_MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final ObjectMapper MAPPER = FAST_MAPPER.copy().
            setDefaultPrettyPrinter(getArraysOnNewLinePrettyPrinter()).
            enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Typed (de)serialization helper that converts checked Jackson failures
     * into {@link IllegalArgumentException}s.
     */
    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final Class<T> valueType;

        public Helper(final Class<T> valueType) {
            this(MAPPER, valueType);
        }

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.mapper = mapper;
            this.valueType = valueType;
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return mapper.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

    }

}
