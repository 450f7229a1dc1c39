package io.batchrun.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.batchrun.core.compactor.EntryData;
import java.io.IOException;
import java.io.Serial;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/// Writes compact-log metadata in the version 1 layout.
///
/// {@snippet lang=json :
/// {"v": 1, "p": 1, "s": "2024-01-01T08:00:00.000000+00:00", "d": [[0, 5], [1, 2], [6, 4]]}
/// }
///
/// `d` holds the deltas, kinds and lengths lists in that order. A log without entries
/// has `"s": ""` and `"d": [[], [], []]`.
///
/// @implNote Package-private. Registered by {@link BatchrunJacksonModule}.
/// @see EntryDataDeserializer for the inverse operation
class EntryDataSerializer extends StdSerializer<EntryData> {

    @Serial private static final long serialVersionUID = 3126587120443905177L;

    /// Start timestamp layout, always with six fraction digits and a numeric offset.
    static final DateTimeFormatter START_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx");

    EntryDataSerializer() {
        super(EntryData.class);
    }

    @Override
    public void serialize(EntryData data, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("v", data.version());
        gen.writeNumberField("p", data.precisionMicros());
        gen.writeStringField(
                "s",
                data.start() == null
                        ? ""
                        : START_FORMAT.format(data.start().atOffset(ZoneOffset.UTC)));
        gen.writeArrayFieldStart("d");
        writeNumbers(gen, data.deltas());
        writeNumbers(gen, data.kinds());
        writeNumbers(gen, data.lengths());
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeNumbers(JsonGenerator gen, List<? extends Number> values)
            throws IOException {
        gen.writeStartArray();
        for (Number value : values) {
            gen.writeNumber(value.longValue());
        }
        gen.writeEndArray();
    }
}
