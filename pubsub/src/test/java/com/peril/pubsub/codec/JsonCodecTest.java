package com.peril.pubsub.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.peril.pubsub.DecodeException;
import com.peril.pubsub.EncodeException;
import com.peril.pubsub.routing.GameLog;
import com.peril.pubsub.routing.PlayingState;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonCodecTest {

    record Move(String player, String toLocation, List<Integer> units) {}

    @Test
    void playingStateUsesOriginalFieldName() throws Exception {
        PayloadCodec<PlayingState> codec = PayloadCodecs.json(PlayingState.class);

        byte[] body = codec.encode(new PlayingState(true));
        JsonNode tree = PayloadCodecs.jsonMapper().readTree(body);

        assertEquals("application/json", codec.contentType());
        assertTrue(tree.get("IsPaused").asBoolean());
        assertEquals(1, tree.size());
    }

    @Test
    void decodesJsonProducedByOtherClients() throws Exception {
        PayloadCodec<PlayingState> codec = PayloadCodecs.json(PlayingState.class);

        PlayingState state = codec.decode("{\"IsPaused\":false,\"Extra\":1}".getBytes(StandardCharsets.UTF_8));

        assertFalse(state.paused());
    }

    @Test
    void roundTripsRecordsWithTimesAndCollections() throws Exception {
        PayloadCodec<GameLog> logs = PayloadCodecs.json(GameLog.class);
        GameLog log = new GameLog(Instant.parse("2024-03-01T12:30:45.123456789Z"), "alice won a war against bob", "alice");
        assertEquals(log, logs.decode(logs.encode(log)));

        PayloadCodec<Move> moves = PayloadCodecs.json(Move.class);
        Move move = new Move("alice", "europe", List.of(1, 2, 3));
        assertEquals(move, moves.decode(moves.encode(move)));
    }

    @Test
    void genericTypesThroughTypeReference() throws Exception {
        PayloadCodec<List<Move>> codec = PayloadCodecs.json(new TypeReference<List<Move>>() {});
        List<Move> moves = List.of(new Move("a", "asia", List.of(7)), new Move("b", "africa", List.of()));

        assertEquals(moves, codec.decode(codec.encode(moves)));
    }

    @Test
    void malformedJsonIsDecodeError() {
        PayloadCodec<PlayingState> codec = PayloadCodecs.json(PlayingState.class);

        assertThrows(DecodeException.class, () -> codec.decode("{\"IsPaused\":".getBytes(StandardCharsets.UTF_8)));
        assertThrows(DecodeException.class, () -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(DecodeException.class, () -> codec.decode(new byte[0]));
        assertThrows(DecodeException.class, () -> codec.decode("null".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void wrongShapeIsDecodeError() {
        PayloadCodec<Move> codec = PayloadCodecs.json(Move.class);

        assertThrows(DecodeException.class, () -> codec.decode("[1,2,3]".getBytes(StandardCharsets.UTF_8)));
        assertThrows(DecodeException.class, () -> codec.decode("\"europe\"".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void unknownPropertiesIgnoredForUnannotatedTypes() throws Exception {
        PayloadCodec<Move> codec = PayloadCodecs.json(Move.class);

        Move move = codec.decode(("{\"player\":\"alice\",\"toLocation\":\"asia\",\"units\":[4],"
                + "\"unknownField\":true,\"nested\":{\"a\":[1]}}").getBytes(StandardCharsets.UTF_8));

        assertEquals(new Move("alice", "asia", List.of(4)), move);
    }

    @Test
    void nullValueIsEncodeError() {
        assertThrows(EncodeException.class, () -> PayloadCodecs.json(PlayingState.class).encode(null));
    }
}
