package io.batchrun.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.batchrun.core.command.ParameterSpec;
import java.io.IOException;
import java.io.Serial;

/// Writes a parameter declaration as `{"type": "int", "required": true, "description": "..."}`.
///
/// The description is omitted when empty.
class ParameterSpecSerializer extends StdSerializer<ParameterSpec> {

    @Serial private static final long serialVersionUID = 8305621904476522511L;

    ParameterSpecSerializer() {
        super(ParameterSpec.class);
    }

    @Override
    public void serialize(ParameterSpec spec, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", spec.type().value());
        gen.writeBooleanField("required", spec.required());
        if (!spec.description().isEmpty()) {
            gen.writeStringField("description", spec.description());
        }
        gen.writeEndObject();
    }
}
