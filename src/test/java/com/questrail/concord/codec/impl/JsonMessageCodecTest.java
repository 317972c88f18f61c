package com.questrail.concord.codec.impl;

import com.questrail.concord.codec.MessageDecodeException;
import com.questrail.concord.message.Envelope;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonMessageCodecTest {

    private final JsonMessageCodec codec = new JsonMessageCodec();

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void decodesEnvelopeFields() {
        Envelope envelope = codec.decode(json(
                "{\"kind\":\"vote\",\"senderId\":\"peer-a\",\"timestamp\":1700000000,"
                        + "\"payload\":{\"proposalId\":\"p1\",\"decision\":true,\"weight\":3}}"));

        assertEquals("vote", envelope.kind());
        assertEquals("peer-a", envelope.senderId());
        assertEquals(1_700_000_000L, envelope.timestamp());
        assertEquals("p1", envelope.payload().get("proposalId"));
        assertEquals(Boolean.TRUE, envelope.payload().get("decision"));
        assertEquals(3, envelope.payload().get("weight"));
    }

    @Test
    void encodedEnvelopeDecodesToEqualFields() {
        Envelope original = new Envelope("move", "peer-b", 42L,
                Map.of("sessionId", "s1", "movePayload", Map.of("cells", List.of(1, 2))));

        Envelope decoded = codec.decode(codec.encode(original));

        assertEquals(original, decoded);
    }

    @Test
    void ignoresUnknownEnvelopeFields() {
        Envelope envelope = codec.decode(json(
                "{\"kind\":\"x\",\"senderId\":\"a\",\"timestamp\":1,\"payload\":{},\"signature\":\"ignored\"}"));
        assertEquals("x", envelope.kind());
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(MessageDecodeException.class, () -> codec.decode(json("{\"kind\":")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    void rejectsNonObjectRoot() {
        assertThrows(MessageDecodeException.class, () -> codec.decode(json("[1,2,3]")));
    }

    @Test
    void rejectsMissingOrMistypedEnvelopeFields() {
        assertThrows(MessageDecodeException.class, () -> codec.decode(json(
                "{\"senderId\":\"a\",\"timestamp\":1,\"payload\":{}}")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(json(
                "{\"kind\":7,\"senderId\":\"a\",\"timestamp\":1,\"payload\":{}}")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(json(
                "{\"kind\":\"vote\",\"timestamp\":1,\"payload\":{}}")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(json(
                "{\"kind\":\"vote\",\"senderId\":\"a\",\"timestamp\":1.5,\"payload\":{}}")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(json(
                "{\"kind\":\"vote\",\"senderId\":\"a\",\"timestamp\":\"1\",\"payload\":{}}")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(json(
                "{\"kind\":\"vote\",\"senderId\":\"a\",\"timestamp\":1,\"payload\":[]}")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(json(
                "{\"kind\":\"vote\",\"senderId\":\"a\",\"timestamp\":1}")));
    }
}
