package com.peril.pubsub.codec;

import com.peril.pubsub.DecodeException;
import com.peril.pubsub.routing.GameLog;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BinaryCodecTest {

    record Score(String player, long points, Map<String, Integer> territories) {}

    @Test
    void taggedAsGenericBinary() {
        assertEquals("application/octet-stream", PayloadCodecs.binary(GameLog.class).contentType());
    }

    @Test
    void roundTripsGameLog() throws Exception {
        PayloadCodec<GameLog> codec = PayloadCodecs.binary(GameLog.class);
        GameLog log = new GameLog(Instant.parse("2024-03-01T12:30:45Z"), "A war between alice and bob resulted in a draw", "bob");

        assertEquals(log, codec.decode(codec.encode(log)));
    }

    @Test
    void roundTripsNestedValues() throws Exception {
        PayloadCodec<Score> codec = PayloadCodecs.binary(Score.class);
        Score score = new Score("carol", 1L << 40, Map.of("europe", 3, "asia", 0));

        assertEquals(score, codec.decode(codec.encode(score)));
    }

    @Test
    void smallerThanJson() throws Exception {
        Score score = new Score("carol", 123456789L, Map.of("europe", 3, "asia", 4, "africa", 5));

        int binary = PayloadCodecs.binary(Score.class).encode(score).length;
        int json = PayloadCodecs.json(Score.class).encode(score).length;

        assertTrue(binary < json, "binary=" + binary + " json=" + json);
    }

    @Test
    void truncatedStreamIsDecodeError() throws Exception {
        PayloadCodec<GameLog> codec = PayloadCodecs.binary(GameLog.class);
        byte[] body = codec.encode(new GameLog(Instant.EPOCH, "message", "dave"));

        byte[] truncated = Arrays.copyOf(body, body.length / 2);

        assertThrows(DecodeException.class, () -> codec.decode(truncated));
    }

    @Test
    void typeMismatchIsDecodeError() throws Exception {
        byte[] text = PayloadCodecs.binary(String.class).encode("not a score");

        assertThrows(DecodeException.class, () -> PayloadCodecs.binary(Score.class).decode(text));
        assertThrows(DecodeException.class, () -> PayloadCodecs.binary(Score.class).decode(new byte[] {(byte) 0xff, 0x00}));
    }

    @Test
    void textCodecCannotReadBinaryBody() throws Exception {
        byte[] body = PayloadCodecs.binary(Score.class).encode(new Score("erin", 1, Map.of()));

        assertThrows(DecodeException.class, () -> PayloadCodecs.json(Score.class).decode(body));
    }
}
