package ai.toolrelay.backend.service;

import ai.toolrelay.backend.model.registry.InstanceMapping;
import ai.toolrelay.backend.model.registry.InstanceReservation;
import ai.toolrelay.backend.model.registry.InstanceState;
import ai.toolrelay.backend.model.registry.RegistrationResult;
import ai.toolrelay.backend.model.registry.RegistrySnapshot;
import ai.toolrelay.backend.model.registry.RouteTarget;
import ai.toolrelay.backend.model.registry.SweepResult;
import ai.toolrelay.backend.model.registry.WorkerRecord;
import ai.toolrelay.backend.model.registry.WorkerStatus;
import ai.toolrelay.backend.service.exception.InstanceCreationInProgressException;
import ai.toolrelay.backend.service.exception.InstanceNotBoundException;
import ai.toolrelay.backend.service.exception.NoWorkerAvailableException;
import ai.toolrelay.backend.service.exception.UnknownWorkerException;
import ai.toolrelay.backend.service.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory store of worker records, the tool index and instance bindings.
 *
 * <p>All three structures are guarded together by a single lock so that no
 * caller ever sees a worker counted as available while it is being evicted,
 * and so that picking a worker and reserving a slot on it happen as one step.
 * The registry performs no I/O; callers release the lock (by returning) before
 * they talk to a worker.
 *
 * <p>Not a singleton: every coordinator owns its own instance, and tests
 * create as many as they like.
 */
@Slf4j
public class WorkerRegistry {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, WorkerRecord> workers = new LinkedHashMap<>();
    private final Map<String, Set<String>> toolIndex = new TreeMap<>();
    private final Set<String> knownTools = new TreeSet<>();
    private final Map<String, InstanceMapping> instances = new LinkedHashMap<>();

    private final Clock clock;
    private final WorkerSelectionStrategy selectionStrategy;
    private final Duration heartbeatTimeout;
    private final Duration offlineRetention;
    private final Duration instanceIdleTimeout;

    /**
     * @param heartbeatTimeout     silence after which the sweep takes a worker OFFLINE
     * @param offlineRetention     how long OFFLINE records stay visible before being purged
     * @param instanceIdleTimeout  idle time after which a binding is dropped, zero disables it
     */
    public WorkerRegistry(Clock clock,
                          WorkerSelectionStrategy selectionStrategy,
                          Duration heartbeatTimeout,
                          Duration offlineRetention,
                          Duration instanceIdleTimeout) {
        this.clock = clock;
        this.selectionStrategy = selectionStrategy;
        this.heartbeatTimeout = heartbeatTimeout;
        this.offlineRetention = offlineRetention;
        this.instanceIdleTimeout = instanceIdleTimeout;
    }

    /**
     * Inserts or replaces a worker record.
     *
     * <p>Replacing an existing id drops every instance bound to the previous
     * record, because a re-registering worker is a new process without the old
     * session state.
     *
     * @param workerId       requested id, generated when blank
     * @param baseUrl        http(s) address of the worker's tool endpoints
     * @param supportedTools tool names the worker hosts
     * @param hostInfo       descriptive metadata, may be null
     * @return effective worker id and what was replaced
     * @throws ValidationException if the url or the tool list is empty or malformed
     */
    public RegistrationResult register(String workerId,
                                       String baseUrl,
                                       Collection<String> supportedTools,
                                       Map<String, Object> hostInfo) {
        String normalizedUrl = normalizeBaseUrl(baseUrl);
        Set<String> tools = normalizeTools(supportedTools);
        String effectiveId = StringUtils.hasText(workerId) ? workerId.trim() : generateWorkerId();

        lock.lock();
        try {
            Instant now = clock.instant();
            WorkerRecord previous = workers.get(effectiveId);
            Set<String> invalidated = Collections.emptySet();
            long generation = 1;

            if (previous != null) {
                invalidated = detachLocked(previous);
                generation = previous.getGeneration() + 1;
            }

            WorkerRecord record = WorkerRecord.builder()
                    .workerId(effectiveId)
                    .baseUrl(normalizedUrl)
                    .supportedTools(tools)
                    .activeInstanceCount(0)
                    .lastHeartbeatAt(now)
                    .registeredAt(now)
                    .status(WorkerStatus.ONLINE)
                    .hostInfo(hostInfo == null ? Map.of() : new LinkedHashMap<>(hostInfo))
                    .generation(generation)
                    .build();

            workers.put(effectiveId, record);
            for (String tool : tools) {
                toolIndex.computeIfAbsent(tool, t -> new TreeSet<>()).add(effectiveId);
                knownTools.add(tool);
            }

            log.debug("Registered worker {} (generation {}) at {} with tools {}",
                    effectiveId, generation, normalizedUrl, tools);
            return new RegistrationResult(effectiveId, previous != null, invalidated);

        } finally {
            lock.unlock();
        }
    }

    /**
     * Refreshes the liveness timestamp of an ONLINE worker.
     *
     * @throws UnknownWorkerException if the id is absent or already OFFLINE
     */
    public void heartbeat(String workerId) {
        lock.lock();
        try {
            WorkerRecord record = workers.get(workerId);
            if (record == null || !record.isOnline()) {
                throw new UnknownWorkerException("Worker " + workerId + " is not registered");
            }
            record.setLastHeartbeatAt(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the worker a new instance of the tool would be placed on right now.
     *
     * @throws NoWorkerAvailableException if no ONLINE worker advertises the tool
     */
    public String pickWorker(String toolName) {
        lock.lock();
        try {
            return pickWorkerLocked(toolName).getWorkerId();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Binds an instance directly to a given worker, bypassing load balancing.
     * Binding the same instance to the same worker twice is a no-op.
     */
    public void bindInstance(String instanceId, String toolName, String workerId) {
        lock.lock();
        try {
            WorkerRecord record = workers.get(workerId);
            if (record == null || !record.isOnline()) {
                throw new UnknownWorkerException("Worker " + workerId + " is not registered");
            }
            if (!record.getSupportedTools().contains(toolName)) {
                throw new ValidationException("Worker " + workerId + " does not host tool " + toolName);
            }

            InstanceMapping existing = instances.get(instanceId);
            if (existing != null) {
                if (existing.getWorkerId().equals(workerId) && existing.getToolName().equals(toolName)) {
                    return;
                }
                throw new ValidationException("Instance " + instanceId + " is already bound to worker "
                        + existing.getWorkerId());
            }

            Instant now = clock.instant();
            instances.put(instanceId, InstanceMapping.builder()
                    .instanceId(instanceId)
                    .toolName(toolName)
                    .workerId(workerId)
                    .state(InstanceState.BOUND)
                    .createdAt(now)
                    .lastUsedAt(now)
                    .workerGeneration(record.getGeneration())
                    .build());
            knownTools.add(toolName);
            record.setActiveInstanceCount(record.getActiveInstanceCount() + 1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the worker a BOUND instance lives on, empty if there is no live binding
     */
    public Optional<String> resolveInstance(String instanceId) {
        lock.lock();
        try {
            InstanceMapping mapping = instances.get(instanceId);
            if (mapping == null || mapping.getState() != InstanceState.BOUND) {
                return Optional.empty();
            }
            WorkerRecord record = workers.get(mapping.getWorkerId());
            if (record == null || !record.isOnline()) {
                return Optional.empty();
            }
            return Optional.of(record.getWorkerId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves the worker for a call on an existing instance and marks the
     * binding as used. Never falls back to another worker.
     *
     * @throws InstanceNotBoundException if there is no live binding for this tool
     * @throws InstanceCreationInProgressException if the create call has not finished yet
     */
    public RouteTarget routeInstance(String instanceId, String toolName) {
        lock.lock();
        try {
            InstanceMapping mapping = instances.get(instanceId);
            if (mapping == null) {
                throw new InstanceNotBoundException("Instance " + instanceId + " is not bound to any live worker");
            }
            if (mapping.getState() == InstanceState.PENDING) {
                throw new InstanceCreationInProgressException("Instance " + instanceId + " is still being created");
            }
            if (!mapping.getToolName().equals(toolName)) {
                throw new InstanceNotBoundException("Instance " + instanceId + " belongs to tool "
                        + mapping.getToolName() + ", not " + toolName);
            }
            WorkerRecord record = workers.get(mapping.getWorkerId());
            if (record == null || !record.isOnline()) {
                throw new IllegalStateException("Instance " + instanceId + " points at missing worker "
                        + mapping.getWorkerId());
            }
            mapping.setLastUsedAt(clock.instant());
            return new RouteTarget(instanceId, toolName, record.getWorkerId(), record.getBaseUrl());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Picks a worker and reserves a PENDING slot on it in one step, or returns
     * the existing binding when the instance id is already BOUND to this tool.
     * A fresh reservation counts towards the worker's load immediately so that
     * concurrent creates spread out.
     */
    public InstanceReservation reserveInstance(String toolName, String instanceId, Object identity) {
        lock.lock();
        try {
            InstanceMapping existing = instances.get(instanceId);
            if (existing != null) {
                if (!existing.getToolName().equals(toolName)) {
                    throw new ValidationException("Instance " + instanceId + " already exists for tool "
                            + existing.getToolName());
                }
                if (existing.getState() == InstanceState.PENDING) {
                    throw new InstanceCreationInProgressException("Instance " + instanceId + " is still being created");
                }
                WorkerRecord owner = workers.get(existing.getWorkerId());
                return new InstanceReservation(instanceId, toolName, owner.getWorkerId(), owner.getBaseUrl(),
                        owner.getGeneration(), false);
            }

            WorkerRecord record = pickWorkerLocked(toolName);
            Instant now = clock.instant();
            instances.put(instanceId, InstanceMapping.builder()
                    .instanceId(instanceId)
                    .toolName(toolName)
                    .workerId(record.getWorkerId())
                    .state(InstanceState.PENDING)
                    .identity(identity)
                    .createdAt(now)
                    .lastUsedAt(now)
                    .workerGeneration(record.getGeneration())
                    .build());
            record.setActiveInstanceCount(record.getActiveInstanceCount() + 1);

            return new InstanceReservation(instanceId, toolName, record.getWorkerId(), record.getBaseUrl(),
                    record.getGeneration(), true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Turns a PENDING reservation into a BOUND instance after the worker
     * accepted the create call.
     *
     * @throws InstanceNotBoundException if the worker was evicted or replaced meanwhile
     */
    public InstanceMapping confirmInstance(InstanceReservation reservation) {
        lock.lock();
        try {
            InstanceMapping mapping = instances.get(reservation.getInstanceId());
            if (!isReservationLocked(mapping, reservation)) {
                throw new InstanceNotBoundException("Worker " + reservation.getWorkerId()
                        + " left the registry while instance " + reservation.getInstanceId() + " was being created");
            }
            mapping.setState(InstanceState.BOUND);
            mapping.setLastUsedAt(clock.instant());
            return mapping.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rolls back a reservation whose create call failed. No-op when the
     * reservation is already gone.
     */
    public void abandonInstance(InstanceReservation reservation) {
        lock.lock();
        try {
            InstanceMapping mapping = instances.get(reservation.getInstanceId());
            if (isReservationLocked(mapping, reservation)) {
                instances.remove(reservation.getInstanceId());
                decrementLocked(reservation.getWorkerId(), reservation.getWorkerGeneration());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops a BOUND instance on explicit finalize.
     *
     * @return the removed binding, empty if there was none
     */
    public Optional<InstanceMapping> releaseInstance(String instanceId) {
        lock.lock();
        try {
            InstanceMapping mapping = instances.get(instanceId);
            if (mapping == null) {
                return Optional.empty();
            }
            if (mapping.getState() == InstanceState.PENDING) {
                throw new InstanceCreationInProgressException("Instance " + instanceId + " is still being created");
            }
            instances.remove(instanceId);
            decrementLocked(mapping.getWorkerId(), mapping.getWorkerGeneration());
            return Optional.of(mapping.copy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a worker entirely, whatever its status, together with every
     * instance bound to it.
     *
     * @return ids of the invalidated instances, empty if the worker was unknown
     */
    public Set<String> evict(String workerId) {
        lock.lock();
        try {
            WorkerRecord record = workers.get(workerId);
            if (record == null) {
                return Collections.emptySet();
            }
            Set<String> invalidated = detachLocked(record);
            workers.remove(workerId);
            return invalidated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * One liveness pass: takes silent workers OFFLINE and drops their
     * instances, purges OFFLINE records past retention, and releases idle
     * instances when an idle timeout is configured.
     */
    public SweepResult sweep() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Map<String, Set<String>> offlined = new LinkedHashMap<>();
            List<String> purged = new ArrayList<>();
            List<String> idleReleased = new ArrayList<>();

            Iterator<WorkerRecord> it = workers.values().iterator();
            while (it.hasNext()) {
                WorkerRecord record = it.next();
                if (record.isOnline()) {
                    if (Duration.between(record.getLastHeartbeatAt(), now).compareTo(heartbeatTimeout) > 0) {
                        Set<String> dropped = detachLocked(record);
                        record.setStatus(WorkerStatus.OFFLINE);
                        record.setOfflineSince(now);
                        offlined.put(record.getWorkerId(), dropped);
                    }
                } else if (record.getOfflineSince() != null
                        && Duration.between(record.getOfflineSince(), now).compareTo(offlineRetention) >= 0) {
                    it.remove();
                    purged.add(record.getWorkerId());
                }
            }

            if (!instanceIdleTimeout.isZero() && !instanceIdleTimeout.isNegative()) {
                Iterator<InstanceMapping> instanceIt = instances.values().iterator();
                while (instanceIt.hasNext()) {
                    InstanceMapping mapping = instanceIt.next();
                    if (mapping.getState() == InstanceState.BOUND
                            && Duration.between(mapping.getLastUsedAt(), now).compareTo(instanceIdleTimeout) > 0) {
                        instanceIt.remove();
                        decrementLocked(mapping.getWorkerId(), mapping.getWorkerGeneration());
                        idleReleased.add(mapping.getInstanceId());
                    }
                }
            }

            return new SweepResult(offlined, purged, idleReleased);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds tool names that should be listed even before any worker offers them.
     */
    public void declareTools(Collection<String> toolNames) {
        lock.lock();
        try {
            toolNames.stream().filter(StringUtils::hasText).map(String::trim).forEach(knownTools::add);
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkerRecord> getWorker(String workerId) {
        lock.lock();
        try {
            WorkerRecord record = workers.get(workerId);
            return record == null ? Optional.empty() : Optional.of(record.copy());
        } finally {
            lock.unlock();
        }
    }

    public RegistrySnapshot snapshot() {
        lock.lock();
        try {
            List<WorkerRecord> workerCopies = workers.values().stream()
                    .map(WorkerRecord::copy)
                    .collect(Collectors.toList());

            Map<String, Set<String>> indexCopy = new TreeMap<>();
            toolIndex.forEach((tool, ids) -> indexCopy.put(tool, Collections.unmodifiableSet(new TreeSet<>(ids))));

            List<InstanceMapping> instanceCopies = instances.values().stream()
                    .map(InstanceMapping::copy)
                    .collect(Collectors.toList());

            return new RegistrySnapshot(
                    clock.instant(),
                    Collections.unmodifiableList(workerCopies),
                    Collections.unmodifiableMap(indexCopy),
                    Collections.unmodifiableSet(new TreeSet<>(knownTools)),
                    Collections.unmodifiableList(instanceCopies));
        } finally {
            lock.unlock();
        }
    }

    public int onlineWorkerCount() {
        lock.lock();
        try {
            return (int) workers.values().stream().filter(WorkerRecord::isOnline).count();
        } finally {
            lock.unlock();
        }
    }

    public int boundInstanceCount() {
        lock.lock();
        try {
            return (int) instances.values().stream().filter(i -> i.getState() == InstanceState.BOUND).count();
        } finally {
            lock.unlock();
        }
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    // Everything below expects the lock to be held

    private WorkerRecord pickWorkerLocked(String toolName) {
        Set<String> ids = toolIndex.getOrDefault(toolName, Collections.emptySet());
        List<WorkerRecord> candidates = ids.stream()
                .map(workers::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        return selectionStrategy.select(toolName, candidates)
                .orElseThrow(() -> new NoWorkerAvailableException("No ONLINE worker supports tool " + toolName));
    }

    /**
     * Removes the worker from the tool index and drops every instance bound to
     * it, leaving the record itself in place.
     */
    private Set<String> detachLocked(WorkerRecord record) {
        String workerId = record.getWorkerId();
        for (String tool : record.getSupportedTools()) {
            Set<String> ids = toolIndex.get(tool);
            if (ids != null) {
                ids.remove(workerId);
                if (ids.isEmpty()) {
                    toolIndex.remove(tool);
                }
            }
        }

        Set<String> dropped = new LinkedHashSet<>();
        Iterator<InstanceMapping> it = instances.values().iterator();
        while (it.hasNext()) {
            InstanceMapping mapping = it.next();
            if (mapping.getWorkerId().equals(workerId)) {
                dropped.add(mapping.getInstanceId());
                it.remove();
            }
        }
        record.setActiveInstanceCount(0);
        return dropped;
    }

    private boolean isReservationLocked(InstanceMapping mapping, InstanceReservation reservation) {
        return mapping != null
                && mapping.getState() == InstanceState.PENDING
                && mapping.getWorkerId().equals(reservation.getWorkerId())
                && mapping.getWorkerGeneration() == reservation.getWorkerGeneration();
    }

    private void decrementLocked(String workerId, long generation) {
        WorkerRecord record = workers.get(workerId);
        if (record != null && record.getGeneration() == generation && record.getActiveInstanceCount() > 0) {
            record.setActiveInstanceCount(record.getActiveInstanceCount() - 1);
        }
    }

    private static String normalizeBaseUrl(String baseUrl) {
        if (!StringUtils.hasText(baseUrl)) {
            throw new ValidationException("base_url must not be empty");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ValidationException("base_url must be an absolute http(s) URL: " + baseUrl);
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("base_url is not a valid URL: " + baseUrl, e);
        }
        return trimmed;
    }

    private static Set<String> normalizeTools(Collection<String> supportedTools) {
        if (supportedTools == null) {
            throw new ValidationException("supported_tools must not be empty");
        }
        Set<String> tools = supportedTools.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .collect(Collectors.toCollection(TreeSet::new));
        if (tools.isEmpty()) {
            throw new ValidationException("supported_tools must not be empty");
        }
        return Collections.unmodifiableSet(tools);
    }

    private static String generateWorkerId() {
        return "worker-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
