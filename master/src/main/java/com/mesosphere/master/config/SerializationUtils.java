package com.mesosphere.master.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.hubspot.jackson.datatype.protobuf.ProtobufModule;

import java.io.IOException;

/**
 * Contains static object serialization utilities for JSON.
 */
public class SerializationUtils {

    /**
     * An Object mapper that can be used for mapping Objects to and from JSON. Includes support for
     * serializing/deserializing Protobuf objects.
     */
    private static final ObjectMapper DEFAULT_JSON_MAPPER = registerDefaultModules(new ObjectMapper());

    private SerializationUtils() {
        // do not instantiate
    }

    /**
     * Returns the provided {@link ObjectMapper} after registering the default modules with it.
     */
    public static ObjectMapper registerDefaultModules(ObjectMapper mapper) {
        // enable support for ...
        return mapper.registerModules(
                new GuavaModule(),     // Guava types
                new Jdk8Module(),      // Optional<>s
                new ProtobufModule()); // Protobuf objects
    }

    /**
     * Returns a JSON representation of the provided value.
     *
     * @throws IOException if conversion fails
     */
    public static <T> String toJsonString(T value) throws IOException {
        return DEFAULT_JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    /**
     * Returns a compact single-line JSON representation of the provided value, or an empty string if conversion
     * fails. Used when rendering identifiers into messages.
     */
    public static <T> String toShortJsonStringOrEmpty(T value) {
        try {
            return DEFAULT_JSON_MAPPER.writeValueAsString(value);
        } catch (IOException e) {
            return "";
        }
    }

    /**
     * Returns the object represented by the provided JSON string created via {@link #toJsonString(Object)}.
     */
    public static <T> T fromJsonString(String str, Class<T> clazz) throws IOException {
        return DEFAULT_JSON_MAPPER.readValue(str, clazz);
    }
}
