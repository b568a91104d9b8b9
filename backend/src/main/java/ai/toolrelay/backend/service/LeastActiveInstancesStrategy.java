package ai.toolrelay.backend.service;

import ai.toolrelay.backend.model.registry.WorkerRecord;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Least-loaded selection: fewest active instances wins, then the worker whose
 * last heartbeat is oldest, then the lexicographically smallest id.
 */
public class LeastActiveInstancesStrategy implements WorkerSelectionStrategy {

    private static final Comparator<WorkerRecord> ORDER = Comparator
            .comparingInt(WorkerRecord::getActiveInstanceCount)
            .thenComparing(WorkerRecord::getLastHeartbeatAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(WorkerRecord::getWorkerId);

    @Override
    public Optional<WorkerRecord> select(String toolName, List<WorkerRecord> candidates) {
        return candidates.stream()
                .filter(WorkerRecord::isOnline)
                .min(ORDER);
    }
}
