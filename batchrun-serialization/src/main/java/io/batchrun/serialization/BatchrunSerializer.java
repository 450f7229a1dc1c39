package io.batchrun.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.batchrun.core.command.ParameterSpec;
import io.batchrun.core.compactor.EntryData;
import io.batchrun.serialization.definitions.Definitions;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/// Utility class for the JSON forms Batchrun stores and reads.
///
/// Covers the compact-log metadata, command parameter schemas, job argument mappings and
/// definitions files. Storage columns are written compactly; only
/// {@link #createMapper()} indents.
///
/// ### Usage
/// {@snippet :
/// String json = BatchrunSerializer.entryDataToJson(log.entryData());
/// EntryData restored = BatchrunSerializer.entryDataFromJson(json);
///
/// Definitions definitions = BatchrunSerializer.readDefinitions(in);
/// }
///
/// @implNote Thread-safe. The shared mappers are configured once and never mutated.
/// @see BatchrunJacksonModule for the registered type handlers
public final class BatchrunSerializer {

    private static final TypeReference<Map<String, ParameterSpec>> PARAMETERS =
            new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> ARGUMENTS =
            new TypeReference<>() {};

    private static final ObjectMapper MAPPER = createMapper();
    private static final ObjectMapper COMPACT =
            createMapper().disable(SerializationFeature.INDENT_OUTPUT);

    private BatchrunSerializer() {}

    /// Creates an ObjectMapper configured for Batchrun types.
    ///
    /// Registers:
    /// - `BatchrunJacksonModule` for metadata and parameter declarations
    /// - `JavaTimeModule` for `Duration` and `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps and durations written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new BatchrunJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Serializes compact-log metadata.
    ///
    /// @param data the metadata, not null
    /// @return single-line JSON, never null
    public static String entryDataToJson(EntryData data) {
        return write(data, "entry data");
    }

    /// Parses compact-log metadata.
    ///
    /// @param json JSON text, not null
    /// @return the metadata, never null
    /// @throws io.batchrun.core.exception.BatchrunException with `INVALID_METADATA` if the
    /// structure is wrong
    /// @throws IllegalArgumentException if the text is not JSON
    public static EntryData entryDataFromJson(String json) {
        JsonNode tree;
        try {
            tree = COMPACT.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize entry data: " + e.getMessage(), e);
        }
        return EntryDataDeserializer.fromTree(tree);
    }

    public static String parametersToJson(Map<String, ParameterSpec> parameters) {
        return write(parameters, "parameters");
    }

    /// Parses a parameter schema.
    ///
    /// @param json JSON object keyed by parameter name, not null
    /// @return the schema in file order, never null
    /// @throws IllegalArgumentException if the schema cannot be read
    public static Map<String, ParameterSpec> parametersFromJson(String json) {
        return read(json, PARAMETERS, "parameters");
    }

    public static String argumentsToJson(Map<String, ?> arguments) {
        return write(arguments, "arguments");
    }

    /// Parses a job argument mapping; integers come back as `Integer`, `Long` or
    /// `BigInteger` depending on magnitude.
    public static Map<String, Object> argumentsFromJson(String json) {
        return read(json, ARGUMENTS, "arguments");
    }

    /// Reads a definitions file.
    ///
    /// @param in JSON input, not null, not closed by this method
    /// @return the definitions, never null
    /// @throws IllegalArgumentException if the file cannot be read
    public static Definitions readDefinitions(InputStream in) {
        try {
            return MAPPER.readerFor(Definitions.class)
                    .without(JsonParser.Feature.AUTO_CLOSE_SOURCE)
                    .readValue(in);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read definitions: " + e.getMessage(), e);
        }
    }

    private static String write(Object value, String what) {
        try {
            return COMPACT.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type, String what) {
        try {
            return COMPACT.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }
}
