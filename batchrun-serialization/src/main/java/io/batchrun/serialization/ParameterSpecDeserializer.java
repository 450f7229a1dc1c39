package io.batchrun.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.batchrun.core.command.ParameterSpec;
import io.batchrun.core.command.ParameterType;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;

/// Reads a parameter declaration.
///
/// `required` defaults to false. The description may be a plain string or an object of
/// translations keyed by language, in which case the English text is preferred, then
/// Finnish, then whichever comes first.
class ParameterSpecDeserializer extends StdDeserializer<ParameterSpec> {

    @Serial private static final long serialVersionUID = -2291734853115906480L;

    ParameterSpecDeserializer() {
        super(ParameterSpec.class);
    }

    @Override
    public ParameterSpec deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Parameter declaration must be an object");
        }
        JsonNode type = root.get("type");
        if (type == null || !type.isTextual()) {
            throw JsonMappingException.from(p, "Parameter type missing");
        }
        ParameterType parameterType;
        try {
            parameterType = ParameterType.fromValue(type.asText());
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
        boolean required = root.path("required").asBoolean(false);
        return new ParameterSpec(parameterType, required, description(root.get("description")));
    }

    private static String description(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isObject()) {
            for (String language : new String[] {"en", "fi"}) {
                if (node.hasNonNull(language)) {
                    return node.get(language).asText();
                }
            }
            Iterator<JsonNode> values = node.elements();
            return values.hasNext() ? values.next().asText() : "";
        }
        return node.asText();
    }
}
