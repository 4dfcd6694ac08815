package com.phillippitts.scriberelay.integration;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.phillippitts.scriberelay.client.protocol.JavaWebSocketTransport;
import com.phillippitts.scriberelay.client.protocol.TransportConnection;
import com.phillippitts.scriberelay.client.protocol.TransportListener;
import com.phillippitts.scriberelay.config.IntegrationTestConfiguration;
import com.phillippitts.scriberelay.relay.SessionRegistry;
import com.phillippitts.scriberelay.testutil.ScriptedUpstreamConnector;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives the relay endpoint over a real socket with the client-side transport. The recognition
 * engine is replaced by {@link ScriptedUpstreamConnector}.
 */
@Tag("integration")
@ActiveProfiles("test")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RelayWebSocketIntegrationTest {

    private static final String SECRET = "test-secret-that-is-at-least-32-bytes-long!!";
    private static final String ALLOWED_ORIGIN = "http://localhost:3000";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private SessionRegistry registry;

    private final List<TransportConnection> opened = new CopyOnWriteArrayList<>();

    @AfterEach
    void closeConnections() {
        opened.forEach(c -> {
            if (c.isOpen()) {
                c.close(1000, "test done");
            }
        });
    }

    private static String token(String subject) throws Exception {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(subject)
                .expirationTime(Date.from(Instant.now().plusSeconds(300)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        jwt.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));
        return jwt.serialize();
    }

    private static String auth(String token) {
        return new JSONObject().put("type", "auth").put("access_token", token).toString();
    }

    private RecordingClient connect(String origin) {
        RecordingClient client = new RecordingClient();
        TransportConnection connection = new JavaWebSocketTransport(Duration.ofSeconds(5)).connect(
                URI.create("ws://localhost:" + port + "/dictate"), Map.of("Origin", origin), client);
        opened.add(connection);
        await().atMost(Duration.ofSeconds(5)).until(() -> client.connection.get() != null || client.closeCode.get() != -1);
        return client;
    }

    @Test
    void streamsAuthenticatedSessionToDone() throws Exception {
        RecordingClient client = connect(ALLOWED_ORIGIN);
        TransportConnection connection = client.connection.get();

        connection.sendText(auth(token("clinician-7")));
        await().atMost(Duration.ofSeconds(5)).until(() -> client.types().contains("ready"));
        assertThat(client.types()).startsWith("authenticated", "ready");

        connection.sendBinary(new byte[3200]);
        await().atMost(Duration.ofSeconds(5)).until(() -> client.types().contains("final"));
        assertThat(client.last("final").getString("text")).isEqualTo(ScriptedUpstreamConnector.TRANSCRIPT);
        assertThat(client.types()).contains("partial");

        connection.sendText(new JSONObject().put("type", "stop").toString());
        await().atMost(Duration.ofSeconds(5)).until(() -> client.closeCode.get() != -1);

        JSONObject stats = client.last("done").getJSONObject("stats");
        assertThat(stats.getLong("audioBytesSent")).isEqualTo(3200);
        assertThat(stats.getInt("finalCount")).isEqualTo(1);
        assertThat(stats.getInt("finalTranscriptLength")).isEqualTo(ScriptedUpstreamConnector.TRANSCRIPT.length());
        assertThat(client.closeCode.get()).isEqualTo(1000);
        await().atMost(Duration.ofSeconds(5)).until(() -> registry.size() == 0);
    }

    @Test
    void rejectsDisallowedOrigin() {
        RecordingClient client = connect("https://evil.example");

        await().atMost(Duration.ofSeconds(5)).until(() -> client.closeCode.get() != -1);

        assertThat(client.closeCode.get()).isEqualTo(4003);
    }

    @Test
    void rejectsInvalidToken() {
        RecordingClient client = connect(ALLOWED_ORIGIN);

        client.connection.get().sendText(auth("not-a-token"));
        await().atMost(Duration.ofSeconds(5)).until(() -> client.closeCode.get() != -1);

        assertThat(client.closeCode.get()).isEqualTo(4002);
        assertThat(client.last("error").getString("error")).isEqualTo("Authentication failed");
    }

    @Test
    void healthReportsActiveSessions() {
        ResponseEntity<Map> response = rest.getForEntity("/health", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "healthy").containsKey("uptime");
    }

    @Test
    void unknownPathAnswersJsonNotFound() {
        ResponseEntity<Map> response = rest.getForEntity("/nope", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("error", "Not found");
    }

    private static final class RecordingClient implements TransportListener {

        final AtomicReference<TransportConnection> connection = new AtomicReference<>();
        final List<JSONObject> messages = new CopyOnWriteArrayList<>();
        final AtomicInteger closeCode = new AtomicInteger(-1);

        @Override
        public void onOpen(TransportConnection c) {
            connection.set(c);
        }

        @Override
        public void onText(String text) {
            messages.add(new JSONObject(text));
        }

        @Override
        public void onBinary(byte[] data) {
        }

        @Override
        public void onClose(int code, String reason) {
            closeCode.compareAndSet(-1, code);
        }

        @Override
        public void onError(Exception error) {
        }

        List<String> types() {
            return messages.stream().map(m -> m.getString("type")).toList();
        }

        JSONObject last(String type) {
            for (int i = messages.size() - 1; i >= 0; i--) {
                if (type.equals(messages.get(i).getString("type"))) {
                    return messages.get(i);
                }
            }
            throw new AssertionError("No " + type + " message in " + types());
        }
    }
}
