package com.stagecraft.stagecraft_backend.model.workflow;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a node variable from JSON into the closed {@link BindingValue} variant.
 */
public class BindingValueDeserializer extends StdDeserializer<BindingValue> {

    public BindingValueDeserializer() {
        super(BindingValue.class);
    }

    @Override
    public BindingValue deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(parser);
        return fromNode(node, parser);
    }

    @Override
    public BindingValue getNullValue(DeserializationContext ctxt) {
        return BindingValue.none();
    }

    private BindingValue fromNode(JsonNode node, JsonParser parser) throws JsonMappingException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return BindingValue.none();
        }
        if (node.isTextual()) {
            return BindingValue.of(node.textValue());
        }
        if (node.isBoolean()) {
            return BindingValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return BindingValue.of(node.doubleValue());
        }
        if (node.isArray()) {
            List<BindingValue> items = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                items.add(fromNode(element, parser));
            }
            return BindingValue.of(items);
        }
        throw JsonMappingException.from(parser,
                "Unsupported variable value '" + node + "'. Use a string, number, boolean, list or null.");
    }
}
