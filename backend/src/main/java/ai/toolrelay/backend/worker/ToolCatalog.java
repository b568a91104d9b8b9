package ai.toolrelay.backend.worker;

import ai.toolrelay.backend.tools.Tool;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Tools this worker hosts: every {@link Tool} bean, or the subset named in
 * configuration.
 */
@Slf4j
public class ToolCatalog {

    private final Map<String, Tool> tools = new TreeMap<>();

    /**
     * @param available every tool implementation on the classpath
     * @param enabled   names to host, empty for all
     * @throws IllegalStateException if an enabled name has no implementation or nothing is left to host
     */
    public ToolCatalog(List<Tool> available, Collection<String> enabled) {
        for (Tool tool : available) {
            if (enabled.isEmpty() || enabled.contains(tool.getName())) {
                tools.put(tool.getName(), tool);
            }
        }
        for (String name : enabled) {
            if (!tools.containsKey(name)) {
                throw new IllegalStateException("No tool implementation named " + name);
            }
        }
        if (tools.isEmpty()) {
            throw new IllegalStateException("Worker has no tools to host");
        }
        log.info("Worker hosts tools: {}", tools.keySet());
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Set<String> getToolNames() {
        return Collections.unmodifiableSet(tools.keySet());
    }
}
