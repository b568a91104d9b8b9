package ai.toolrelay.backend.worker;

import ai.toolrelay.backend.model.dto.RegisterWorkerRequest;
import ai.toolrelay.backend.model.dto.RegisterWorkerResponse;
import ai.toolrelay.backend.service.exception.UnknownWorkerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.util.StringUtils;

import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps this worker known to the master: registers once the web server is
 * listening, retries with backoff until the master answers, heartbeats at a
 * fixed period and registers again when the master has forgotten it.
 */
@Slf4j
public class WorkerAgent {

    private final MasterClient masterClient;
    private final ToolCatalog toolCatalog;
    private final RegistrationBackoff backoff;
    private final String configuredWorkerId;
    private final String advertisedUrl;
    private final String pathPrefix;
    private final Duration heartbeatInterval;

    private final AtomicBoolean registered = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger failedAttempts = new AtomicInteger(0);

    private volatile String workerId;
    private volatile String baseUrl;
    private volatile int port;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> registrationTask;
    private ScheduledFuture<?> heartbeatTask;

    public WorkerAgent(MasterClient masterClient,
                       ToolCatalog toolCatalog,
                       RegistrationBackoff backoff,
                       String configuredWorkerId,
                       String advertisedUrl,
                       String pathPrefix,
                       Duration heartbeatInterval) {
        this.masterClient = masterClient;
        this.toolCatalog = toolCatalog;
        this.backoff = backoff;
        this.configuredWorkerId = configuredWorkerId;
        this.advertisedUrl = advertisedUrl;
        this.pathPrefix = pathPrefix;
        this.heartbeatInterval = heartbeatInterval;
        this.workerId = StringUtils.hasText(configuredWorkerId) ? configuredWorkerId.trim() : null;
    }

    @EventListener
    public void onWebServerInitialized(WebServerInitializedEvent event) {
        // Ignore the separate management server, if any
        if (event.getApplicationContext().getServerNamespace() == null) {
            start(event.getWebServer().getPort());
        }
    }

    /**
     * Begins registration in the background.
     *
     * @param serverPort port the worker endpoints listen on
     */
    public synchronized void start(int serverPort) {
        if (scheduler != null) {
            return;
        }
        this.port = serverPort;
        masterClient.useLocalMasterIfUnset(serverPort);
        this.baseUrl = resolveBaseUrl(serverPort);
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "worker-agent");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Worker agent starting: base url {}, master {}", baseUrl, masterClient.getMasterUrl());
        scheduleRegistration(Duration.ZERO);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        cancel(registrationTask);
        cancel(heartbeatTask);

        if (registered.getAndSet(false) && workerId != null) {
            try {
                masterClient.unregister(workerId);
                log.info("Worker {} unregistered from master", workerId);
            } catch (MasterUnavailableException e) {
                log.warn("Could not unregister worker {} on shutdown: {}", workerId, e.getMessage());
            }
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    void attemptRegistration() {
        if (stopped.get()) {
            return;
        }
        try {
            RegisterWorkerResponse response = masterClient.register(buildRegistration());
            workerId = response.getWorkerId();
            registered.set(true);
            failedAttempts.set(0);
            log.info("Registered with master {} as worker {} (tools {})",
                    masterClient.getMasterUrl(), workerId, toolCatalog.getToolNames());
            startHeartbeat();
        } catch (RuntimeException e) {
            Duration delay = backoff.delayFor(failedAttempts.getAndIncrement());
            log.warn("Registration with {} failed ({}), retrying in {}ms",
                    masterClient.getMasterUrl(), e.getMessage(), delay.toMillis());
            scheduleRegistration(delay);
        }
    }

    void sendHeartbeat() {
        String id = workerId;
        if (!registered.get() || id == null) {
            return;
        }
        try {
            masterClient.heartbeat(id);
            log.debug("Heartbeat sent for worker {}", id);
        } catch (UnknownWorkerException e) {
            log.warn("Master no longer knows worker {}, registering again", id);
            registered.set(false);
            cancel(heartbeatTask);
            scheduleRegistration(Duration.ZERO);
        } catch (RuntimeException e) {
            log.warn("Heartbeat for worker {} failed: {}", id, e.getMessage());
        }
    }

    RegisterWorkerRequest buildRegistration() {
        return RegisterWorkerRequest.builder()
                .workerId(workerId)
                .baseUrl(baseUrl)
                .supportedTools(new ArrayList<>(toolCatalog.getToolNames()))
                .hostInfo(hostInfo())
                .build();
    }

    public boolean isRegistered() {
        return registered.get();
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getMasterUrl() {
        return masterClient.getMasterUrl();
    }

    private synchronized void scheduleRegistration(Duration delay) {
        if (scheduler == null || stopped.get()) {
            return;
        }
        registrationTask = scheduler.schedule(this::attemptRegistration, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void startHeartbeat() {
        if (scheduler == null || stopped.get()) {
            return;
        }
        cancel(heartbeatTask);
        heartbeatTask = scheduler.scheduleWithFixedDelay(
                this::sendHeartbeat,
                heartbeatInterval.toMillis(),
                heartbeatInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    private String resolveBaseUrl(int serverPort) {
        if (StringUtils.hasText(advertisedUrl)) {
            return advertisedUrl.trim();
        }
        return "http://" + localAddress() + ":" + serverPort + pathPrefix;
    }

    private Map<String, Object> hostInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("hostname", localHostName());
        info.put("ip", localAddress());
        info.put("port", port);
        if (StringUtils.hasText(configuredWorkerId)) {
            info.put("configured_id", configuredWorkerId);
        }
        return info;
    }

    private static String localAddress() {
        try {
            return InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            log.debug("Local address lookup failed, using loopback: {}", e.getMessage());
            return "127.0.0.1";
        }
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Host name lookup failed: {}", e.getMessage());
            return "localhost";
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
