package ai.toolrelay.backend.service;

import ai.toolrelay.backend.model.registry.WorkerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Picks the worker that should host a new tool instance.
 *
 * Called by {@link WorkerRegistry} while it holds its lock, with the ONLINE
 * workers advertising the tool. Implementations must not block or cache.
 */
public interface WorkerSelectionStrategy {

    Optional<WorkerRecord> select(String toolName, List<WorkerRecord> candidates);
}
