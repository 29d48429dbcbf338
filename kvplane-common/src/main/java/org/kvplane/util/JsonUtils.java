package org.kvplane.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.kvplane.enums.StatusEnum;
import org.kvplane.exception.KvPlaneException;

import java.io.IOException;
import java.io.InputStream;

public class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ObjectWriter WRITER;

    private static final ObjectReader READER;

    static {
        MAPPER.registerModule(new JavaTimeModule());
        MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        MAPPER.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        MAPPER.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        WRITER = MAPPER.writer();
        READER = MAPPER.reader();
    }

    /**
     * Convert a json string to a java object.
     *
     * @param text  The json string.
     * @param clazz The expected java object type.
     * @return The java object.
     */
    public static <T> T toObject(String text, Class<T> clazz) throws KvPlaneException {
        ObjectReader reader = MAPPER.readerFor(clazz);
        try {
            T res = reader.readValue(text);
            if (res == null) {
                throw new IOException("The result of json mapper is null.");
            }
            return res;
        } catch (IOException e) {
            throw StatusEnum.JSON_MAPPER_ERROR.toException("msg=" + e.getMessage() + ", text=" + text, e);
        }
    }

    /**
     * Convert a json stream to a java object. The stream is not closed.
     */
    public static <T> T toObject(InputStream input, Class<T> clazz) throws KvPlaneException {
        ObjectReader reader = MAPPER.readerFor(clazz);
        try {
            T res = reader.readValue(input);
            if (res == null) {
                throw new IOException("The result of json mapper is null.");
            }
            return res;
        } catch (IOException e) {
            throw StatusEnum.JSON_MAPPER_ERROR.toException(e.getMessage(), e);
        }
    }

    /**
     * Convert an object to json string.
     *
     * @param object The object.
     * @return The json string.
     * @throws KvPlaneException Failed to convert.
     */
    public static String toString(Object object) throws KvPlaneException {
        try {
            return WRITER.writeValueAsString(object);
        } catch (JsonProcessingException error) {
            throw StatusEnum.JSON_MAPPER_ERROR.toException("Failed to convert object to json string!", error);
        }
    }

    /**
     * Convert a string to a json node.
     *
     * @param text The json string.
     * @return The json node.
     */
    public static JsonNode toTreeNode(String text) throws KvPlaneException {
        try {
            return READER.readTree(text);
        } catch (JsonProcessingException error) {
            throw StatusEnum.JSON_MAPPER_ERROR.toException("Failed to parse text to json tree!, text=" + text, error);
        }
    }
}
