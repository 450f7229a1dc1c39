package io.batchrun.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.batchrun.core.compactor.EntryData;
import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.io.IOException;
import java.io.Serial;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/// Reads compact-log metadata written by {@link EntryDataSerializer}.
///
/// Every structural problem is reported as a {@link BatchrunException} with
/// {@link ErrorCode#INVALID_METADATA}, including an unknown version, a non-integer
/// precision, a start timestamp without offset and a `d` that is not three lists.
///
/// @implNote Package-private. Registered by {@link BatchrunJacksonModule}; the tree form
/// {@link #fromTree(JsonNode)} is used directly by {@link BatchrunSerializer}.
class EntryDataDeserializer extends StdDeserializer<EntryData> {

    @Serial private static final long serialVersionUID = -4409123660718221938L;

    EntryDataDeserializer() {
        super(EntryData.class);
    }

    @Override
    public EntryData deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        return fromTree(p.getCodec().readTree(p));
    }

    static EntryData fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw invalid("Metadata must be an object");
        }
        JsonNode version = root.get("v");
        if (version == null
                || !version.isIntegralNumber()
                || version.asInt() != EntryData.VERSION) {
            throw invalid("Unsupported version: " + version);
        }
        JsonNode precision = root.get("p");
        if (precision == null || !precision.isIntegralNumber()) {
            throw invalid("Invalid precision: " + precision);
        }
        JsonNode start = root.get("s");
        if (start == null || !start.isTextual()) {
            throw invalid("Invalid start timestamp: " + start);
        }
        JsonNode data = root.get("d");
        if (data == null || !data.isArray()) {
            throw invalid("Invalid data type: " + (data == null ? "null" : data.getNodeType()));
        }
        if (data.size() != 3) {
            throw invalid("Data length mismatch: " + data.size());
        }

        List<Long> deltas = new ArrayList<>();
        for (JsonNode delta : numbers(data.get(0))) {
            deltas.add(delta.asLong());
        }
        List<Integer> kinds = new ArrayList<>();
        for (JsonNode kind : numbers(data.get(1))) {
            kinds.add(kind.asInt());
        }
        List<Integer> lengths = new ArrayList<>();
        for (JsonNode length : numbers(data.get(2))) {
            lengths.add(length.asInt());
        }

        String startText = start.asText();
        if (startText.isEmpty()) {
            if (!deltas.isEmpty() || !kinds.isEmpty() || !lengths.isEmpty()) {
                throw invalid("Entries present without start timestamp");
            }
            return new EntryData(
                    EntryData.VERSION, precision.asLong(), null, deltas, kinds, lengths);
        }
        OffsetDateTime parsed;
        try {
            parsed = OffsetDateTime.parse(startText);
        } catch (DateTimeParseException e) {
            throw new BatchrunException(
                    ErrorCode.INVALID_METADATA, "Invalid start timestamp: " + startText, e);
        }
        return new EntryData(
                EntryData.VERSION, precision.asLong(), parsed.toInstant(), deltas, kinds, lengths);
    }

    private static JsonNode numbers(JsonNode list) {
        if (!list.isArray()) {
            throw invalid("Invalid data type: " + list.getNodeType());
        }
        for (JsonNode value : list) {
            if (!value.isIntegralNumber()) {
                throw invalid("Invalid data value: " + value);
            }
        }
        return list;
    }

    private static BatchrunException invalid(String message) {
        return new BatchrunException(ErrorCode.INVALID_METADATA, message);
    }
}
