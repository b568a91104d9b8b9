package ai.toolrelay.backend.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A stateful capability hosted by a worker. Each instance id names one
 * independent session; implementations must be safe for concurrent calls on
 * different instances.
 */
public interface Tool {

    /**
     * Name used in URLs and in the coordinator's tool index.
     */
    String getName();

    /**
     * Opens a session.
     *
     * @param identity opaque payload from the caller, may be null
     * @return optional payload echoed to the caller as {@code result}
     */
    JsonNode create(String instanceId, JsonNode identity);

    /**
     * Runs one step of the session.
     *
     * @throws ToolExecutionException if the instance does not exist
     */
    ToolResult execute(String instanceId, JsonNode parameters);

    /**
     * Final reward for the session; zero for unknown instances.
     */
    double calcReward(String instanceId);

    /**
     * Closes the session. Releasing an unknown instance is not an error.
     */
    void release(String instanceId);
}
