package ai.toolrelay.backend.service;

import ai.toolrelay.backend.config.ProxyProperties;
import ai.toolrelay.backend.model.dto.CreateInstanceResponse;
import ai.toolrelay.backend.service.exception.InstanceNotBoundException;
import ai.toolrelay.backend.service.exception.NoWorkerAvailableException;
import ai.toolrelay.backend.service.exception.ValidationException;
import ai.toolrelay.backend.service.exception.WorkerCallFailedException;
import ai.toolrelay.backend.service.exception.WorkerTimeoutException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolRoutingServiceTest {

    @Mock
    private WorkerProxyClient proxyClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private WorkerRegistry registry;
    private ProxyProperties proxyProperties;
    private SimpleMeterRegistry meterRegistry;
    private ToolRoutingService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        registry = new WorkerRegistry(clock, new LeastActiveInstancesStrategy(), Duration.ofSeconds(60),
                Duration.ofMinutes(5), Duration.ZERO);
        proxyProperties = new ProxyProperties();
        meterRegistry = new SimpleMeterRegistry();
        service = new ToolRoutingService(registry, proxyClient, proxyProperties,
                new CoordinatorMetrics(meterRegistry, registry));

        registry.register("w1", "http://w1:9000/worker", List.of("calc"), null);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void createBindsInstanceToPickedWorker() throws Exception {
        when(proxyClient.post(eq("http://w1:9000/worker"), eq("calc"), eq("create"), any(), any()))
                .thenReturn(json("{\"success\":true,\"result\":\"i1\"}"));

        CreateInstanceResponse response = service.create("calc", "i1", json("{\"user\":\"u\"}"), null);

        assertThat(response.getInstanceId()).isEqualTo("i1");
        assertThat(response.getWorkerId()).isEqualTo("w1");
        assertThat(response.isCreated()).isTrue();
        assertThat(response.getResult().asText()).isEqualTo("i1");
        assertThat(registry.resolveInstance("i1")).contains("w1");

        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(proxyClient).post(anyString(), anyString(), anyString(), body.capture(), any());
        JsonNode sent = (JsonNode) body.getValue();
        assertThat(sent.get("instance_id").asText()).isEqualTo("i1");
        assertThat(sent.get("identity").get("user").asText()).isEqualTo("u");
    }

    @Test
    void createGeneratesInstanceIdWhenAbsent() throws Exception {
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any())).thenReturn(json("{}"));

        CreateInstanceResponse response = service.create("calc", null, null, null);

        assertThat(response.getInstanceId()).isNotBlank();
        assertThat(registry.resolveInstance(response.getInstanceId())).contains("w1");
    }

    @Test
    @DisplayName("creating an already bound id makes no worker call and adds no load")
    void duplicateCreateIsNoOp() throws Exception {
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any())).thenReturn(json("{}"));
        service.create("calc", "i1", null, null);

        CreateInstanceResponse again = service.create("calc", "i1", null, null);

        assertThat(again.isCreated()).isFalse();
        assertThat(again.getWorkerId()).isEqualTo("w1");
        verify(proxyClient, times(1)).post(anyString(), anyString(), anyString(), any(), any());
        assertThat(registry.getWorker("w1").orElseThrow().getActiveInstanceCount()).isEqualTo(1);
    }

    @Test
    void failedCreateRollsBackReservation() {
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any()))
                .thenThrow(new WorkerCallFailedException("down"));

        assertThatThrownBy(() -> service.create("calc", "i1", null, null))
                .isInstanceOf(WorkerCallFailedException.class);

        assertThat(registry.snapshot().getInstances()).isEmpty();
        assertThat(registry.getWorker("w1").orElseThrow().getActiveInstanceCount()).isZero();
        assertThat(meterRegistry.get("toolrelay.proxy.calls").tag("outcome", "WorkerCallFailed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void createWithoutWorkersFailsWithoutCalling() {
        assertThatThrownBy(() -> service.create("search", "i1", null, null))
                .isInstanceOf(NoWorkerAvailableException.class);
        verify(proxyClient, never()).post(anyString(), anyString(), anyString(), any(), any());
    }

    @Test
    void createFailsWhenWorkerEvictedDuringCall() throws Exception {
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any())).thenAnswer(invocation -> {
            registry.evict("w1");
            return json("{}");
        });

        assertThatThrownBy(() -> service.create("calc", "i1", null, null))
                .isInstanceOf(InstanceNotBoundException.class);
        assertThat(registry.resolveInstance("i1")).isEmpty();
    }

    @Test
    void executeForwardsToBoundWorkerAndReturnsResponseUnchanged() throws Exception {
        registry.bindInstance("i1", "calc", "w1");
        JsonNode workerResponse = json("{\"response\":\"ok\",\"reward_score\":0.1,\"metrics\":{}}");
        when(proxyClient.post(eq("http://w1:9000/worker"), eq("calc"), eq("execute"), any(), any()))
                .thenReturn(workerResponse);

        JsonNode result = service.execute("calc", "i1", json("{\"operation\":\"add\"}"), null);

        assertThat(result).isSameAs(workerResponse);
        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(proxyClient).post(anyString(), anyString(), anyString(), body.capture(), any());
        assertThat(((JsonNode) body.getValue()).get("parameters").get("operation").asText()).isEqualTo("add");
    }

    @Test
    @DisplayName("execute on an instance of a dead worker fails instead of moving to another worker")
    void executeOnEvictedWorkerIsNotRerouted() {
        registry.bindInstance("i1", "calc", "w1");
        clock.advance(Duration.ofSeconds(30));
        registry.register("w2", "http://w2:9000/worker", List.of("calc"), null);
        clock.advance(Duration.ofSeconds(31));
        registry.sweep();

        assertThatThrownBy(() -> service.execute("calc", "i1", null, null))
                .isInstanceOf(InstanceNotBoundException.class);
        verify(proxyClient, never()).post(anyString(), anyString(), anyString(), any(), any());
    }

    @Test
    void executeRequiresInstanceId() {
        assertThatThrownBy(() -> service.execute("calc", " ", null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void timeoutDoesNotEvictWorker() {
        registry.bindInstance("i1", "calc", "w1");
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any()))
                .thenThrow(new WorkerTimeoutException("slow"));

        assertThatThrownBy(() -> service.execute("calc", "i1", null, null))
                .isInstanceOf(WorkerTimeoutException.class);

        assertThat(registry.getWorker("w1").orElseThrow().isOnline()).isTrue();
        assertThat(registry.resolveInstance("i1")).contains("w1");
    }

    @Test
    void releaseDropsBindingEvenWhenWorkerFails() {
        registry.bindInstance("i1", "calc", "w1");
        when(proxyClient.post(anyString(), anyString(), eq("release"), any(), any()))
                .thenThrow(new WorkerCallFailedException("gone"));

        assertThatThrownBy(() -> service.release("calc", "i1", null))
                .isInstanceOf(WorkerCallFailedException.class);

        assertThat(registry.resolveInstance("i1")).isEmpty();
        assertThat(registry.getWorker("w1").orElseThrow().getActiveInstanceCount()).isZero();
    }

    @Test
    void calcRewardIsRoutedByAffinity() throws Exception {
        registry.bindInstance("i1", "calc", "w1");
        when(proxyClient.post(eq("http://w1:9000/worker"), eq("calc"), eq("calc_reward"), any(), any()))
                .thenReturn(json("{\"reward_score\":0.9}"));

        assertThat(service.calcReward("calc", "i1", null).get("reward_score").asDouble()).isEqualTo(0.9);
    }

    @Test
    void timeoutResolutionPrefersOverrideThenToolThenDefault() throws Exception {
        registry.bindInstance("i1", "calc", "w1");
        proxyProperties.setDefaultTimeout(Duration.ofSeconds(300));
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any())).thenReturn(json("{}"));

        service.execute("calc", "i1", null, null);
        verify(proxyClient).post(anyString(), anyString(), anyString(), any(), eq(Duration.ofSeconds(300)));

        proxyProperties.getToolTimeouts().put("calc", Duration.ofSeconds(30));
        service.execute("calc", "i1", null, null);
        verify(proxyClient).post(anyString(), anyString(), anyString(), any(), eq(Duration.ofSeconds(30)));

        service.execute("calc", "i1", null, Duration.ofMillis(1500));
        verify(proxyClient).post(anyString(), anyString(), anyString(), any(), eq(Duration.ofMillis(1500)));
    }

    @Test
    void createLostToEvictionIsCountedAsNotBound() {
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any())).thenAnswer(invocation -> {
            registry.evict("w1");
            return json("{}");
        });

        assertThatThrownBy(() -> service.create("calc", "i1", null, null))
                .isInstanceOf(InstanceNotBoundException.class);

        assertThat(meterRegistry.find("toolrelay.proxy.calls").tag("operation", "create")
                .tag("outcome", "InstanceNotBound").counter()).isNotNull();
        assertThat(meterRegistry.find("toolrelay.proxy.calls").tag("outcome", "success").counter()).isNull();
    }

    @Test
    void unexpectedFailureIsCountedAsError() {
        registry.bindInstance("i1", "calc", "w1");
        when(proxyClient.post(anyString(), anyString(), anyString(), any(), any()))
                .thenThrow(new IllegalStateException("no converter"));

        assertThatThrownBy(() -> service.execute("calc", "i1", null, null))
                .isInstanceOf(IllegalStateException.class);

        assertThat(meterRegistry.get("toolrelay.proxy.calls").tag("operation", "execute")
                .tag("outcome", "error").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("toolrelay.proxy.calls").tag("outcome", "success").counter()).isNull();
    }
}
