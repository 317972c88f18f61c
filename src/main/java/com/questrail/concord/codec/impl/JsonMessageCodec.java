package com.questrail.concord.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.concord.codec.MessageCodec;
import com.questrail.concord.codec.MessageDecodeException;
import com.questrail.concord.message.Envelope;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * JsonMessageCodec
 * -----------------------------------------------------------------------------
 * Jackson-backed {@link MessageCodec}. One message is one JSON object:
 *
 * <pre>
 *   {"kind":"vote","senderId":"peer-a","timestamp":1700000000,"payload":{...}}
 * </pre>
 *
 * <p>Envelope fields are validated strictly (text, text, integral number,
 * object). Payload values are handed on as plain Java maps, lists, strings,
 * numbers and booleans; their meaning is checked by the decode layer.</p>
 */
public final class JsonMessageCodec implements MessageCodec
{
    static final String KIND = "kind";
    static final String SENDER_ID = "senderId";
    static final String TIMESTAMP = "timestamp";
    static final String PAYLOAD = "payload";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonMessageCodec() {
        this(new ObjectMapper());
    }

    public JsonMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        ObjectNode root = mapper.createObjectNode();
        root.put(KIND, envelope.kind());
        root.put(SENDER_ID, envelope.senderId());
        root.put(TIMESTAMP, envelope.timestamp());
        root.set(PAYLOAD, mapper.valueToTree(envelope.payload()));

        try {
            return mapper.writeValueAsBytes(root);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Envelope payload is not JSON-serializable", e);
        }
    }

    @Override
    public Envelope decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        final JsonNode root;
        try {
            root = mapper.readTree(payload);
        }
        catch (IOException e) {
            throw new MessageDecodeException("Message is not valid JSON", e);
        }

        if (root == null || !root.isObject()) {
            throw new MessageDecodeException("Message is not a JSON object");
        }

        JsonNode kind = root.get(KIND);
        if (kind == null || !kind.isTextual()) {
            throw new MessageDecodeException("Envelope field '" + KIND + "' missing or not text");
        }

        JsonNode senderId = root.get(SENDER_ID);
        if (senderId == null || !senderId.isTextual()) {
            throw new MessageDecodeException("Envelope field '" + SENDER_ID + "' missing or not text");
        }

        JsonNode timestamp = root.get(TIMESTAMP);
        if (timestamp == null || !timestamp.isIntegralNumber()) {
            throw new MessageDecodeException("Envelope field '" + TIMESTAMP + "' missing or not an integer");
        }

        JsonNode body = root.get(PAYLOAD);
        if (body == null || !body.isObject()) {
            throw new MessageDecodeException("Envelope field '" + PAYLOAD + "' missing or not an object");
        }

        Map<String, Object> fields = mapper.convertValue(body, MAP_TYPE);
        return new Envelope(kind.asText(), senderId.asText(), timestamp.asLong(), fields);
    }
}
