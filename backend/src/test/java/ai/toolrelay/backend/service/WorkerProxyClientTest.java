package ai.toolrelay.backend.service;

import ai.toolrelay.backend.service.exception.WorkerCallFailedException;
import ai.toolrelay.backend.service.exception.WorkerTimeoutException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for WorkerProxyClient using MockWebServer.
 */
class WorkerProxyClientTest {

    private MockWebServer mockWebServer;
    private WorkerProxyClient client;
    private String baseUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        String url = mockWebServer.url("/worker").toString();
        baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        client = new WorkerProxyClient(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void forwardsBodyAndReturnsResponseUnchanged() throws Exception {
        String workerBody = "{\"response\":\"Result: 3\",\"reward_score\":0.1,\"metrics\":{\"operation_count\":1}}";
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(workerBody));

        JsonNode result = client.post(baseUrl, "calc", "execute",
                Map.of("instance_id", "i1", "parameters", Map.of("operation", "add")), Duration.ofSeconds(2));

        assertEquals(objectMapper.readTree(workerBody), result);

        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("/worker/calc/execute", request.getPath());
        assertEquals("POST", request.getMethod());
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        JsonNode sent = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("i1", sent.get("instance_id").asText());
        assertEquals("add", sent.get("parameters").get("operation").asText());
    }

    @Test
    void emptyBodyBecomesEmptyObject() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));

        JsonNode result = client.post(baseUrl, "calc", "release", Map.of("instance_id", "i1"), Duration.ofSeconds(2));

        assertThat(result.isObject()).isTrue();
        assertThat(result.size()).isZero();
    }

    @Test
    void slowWorkerYieldsTimeout() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> client.post(baseUrl, "calc", "execute", Map.of("instance_id", "i1"),
                Duration.ofMillis(200)))
                .isInstanceOf(WorkerTimeoutException.class)
                .satisfies(e -> assertThat(((WorkerTimeoutException) e).isRetryable()).isTrue());
    }

    @Test
    void serverErrorYieldsCallFailed() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> client.post(baseUrl, "calc", "execute", Map.of("instance_id", "i1"),
                Duration.ofSeconds(2)))
                .isInstanceOf(WorkerCallFailedException.class)
                .hasMessageContaining("500");
    }

    @Test
    void reportedFailureYieldsCallFailed() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"success\":false,\"error\":\"identity missing\"}"));

        assertThatThrownBy(() -> client.post(baseUrl, "calc", "create", Map.of("instance_id", "i1"),
                Duration.ofSeconds(2)))
                .isInstanceOf(WorkerCallFailedException.class)
                .hasMessageContaining("identity missing");
    }

    @Test
    void droppedConnectionYieldsCallFailed() {
        // HttpURLConnection may retry a POST once on a dropped connection
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        assertThatThrownBy(() -> client.post(baseUrl, "calc", "execute", Map.of("instance_id", "i1"),
                Duration.ofSeconds(2)))
                .isInstanceOf(WorkerCallFailedException.class);
    }

    @Test
    void reachabilityProbeUsesHealthEndpoint() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"status\":\"ok\"}"));
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));

        assertThat(client.isReachable(baseUrl, Duration.ofSeconds(1))).isTrue();
        assertThat(client.isReachable(baseUrl, Duration.ofSeconds(1))).isFalse();
        assertEquals("/worker/health", mockWebServer.takeRequest().getPath());
    }

    @Test
    void callerChosenTimeoutsShareOneClient() {
        RestTemplate template = client.getRestTemplate();
        for (int i = 0; i < 50; i++) {
            mockWebServer.enqueue(new MockResponse()
                    .setResponseCode(200)
                    .setHeader("Content-Type", "application/json")
                    .setBody("{}"));
            client.post(baseUrl, "calc", "execute", Map.of("instance_id", "i1"), Duration.ofMillis(10_000 + i));
        }

        assertThat(client.getRestTemplate()).isSameAs(template);
        assertThat(mockWebServer.getRequestCount()).isEqualTo(50);
    }

    @Test
    void eachCallKeepsItsOwnDeadline() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"ok\":true}")
                .setHeadersDelay(500, TimeUnit.MILLISECONDS));
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        JsonNode patient = client.post(baseUrl, "calc", "execute", Map.of("instance_id", "i1"), Duration.ofSeconds(5));
        assertThat(patient.get("ok").asBoolean()).isTrue();

        assertThatThrownBy(() -> client.post(baseUrl, "calc", "execute", Map.of("instance_id", "i1"),
                Duration.ofMillis(200)))
                .isInstanceOf(WorkerTimeoutException.class);
    }
}
