package org.akkordio.fingering.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.experimental.UtilityClass;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON rendering of {@link FingeringSolution} for the HTTP layer.
 */
@UtilityClass
public final class FingeringSolutionJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    /**
     * Serializes a solution to compact JSON.
     */
    public static String toJson(FingeringSolution solution) {
        return write(solution, false);
    }

    /**
     * Serializes a solution to indented JSON.
     */
    public static String toPrettyJson(FingeringSolution solution) {
        return write(solution, true);
    }

    private static String write(FingeringSolution solution, boolean pretty) {
        Objects.requireNonNull(solution, "solution");
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(solution)
                    : MAPPER.writeValueAsString(solution);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("failed to serialize fingering solution", ex);
        }
    }
}
