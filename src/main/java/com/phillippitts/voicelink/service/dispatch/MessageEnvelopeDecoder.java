package com.phillippitts.voicelink.service.dispatch;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phillippitts.voicelink.domain.InboundMessage;
import com.phillippitts.voicelink.exception.MessageDecodeException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes a raw text frame into an {@link InboundMessage}.
 *
 * <p>The frame must hold exactly one RFC 8259 JSON object. Arrays, scalars, empty frames,
 * trailing content and lenient syntax (unquoted keys, single quotes, trailing commas) are
 * rejected. A repeated key keeps its last value.
 */
@Component
public class MessageEnvelopeDecoder {

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /**
     * @param raw text frame as received
     * @return classified message
     * @throws MessageDecodeException if the frame is not a single JSON object
     */
    public InboundMessage decode(String raw) {
        if (raw == null) {
            throw new MessageDecodeException("Frame is null");
        }
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JacksonException e) {
            throw new MessageDecodeException(e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MessageDecodeException("Expected a JSON object but got "
                    + (node == null || node.isMissingNode() ? "no content" : node.getNodeType().name().toLowerCase(Locale.ROOT)));
        }
        return InboundMessage.of((JSONObject) toJson(node));
    }

    // JSON null maps to JSONObject.NULL so explicit nulls stay distinguishable from absent keys.
    private static Object toJson(JsonNode node) {
        if (node.isObject()) {
            JSONObject object = new JSONObject();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                object.put(field.getKey(), toJson(field.getValue()));
            }
            return object;
        }
        if (node.isArray()) {
            JSONArray array = new JSONArray();
            for (JsonNode element : node) {
                array.put(toJson(element));
            }
            return array;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return JSONObject.NULL;
    }
}
