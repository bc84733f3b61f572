package com.peril.server;

import com.peril.pubsub.AckType;
import com.peril.pubsub.routing.GameLog;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppTest {

    @Test
    void gameLogsAreAcknowledged() {
        GameLog gl = new GameLog(Instant.parse("2024-05-01T10:00:00Z"), "alice won a war against bob", "alice");

        assertEquals(AckType.ACK, App.handleGameLog(gl));
    }
}
