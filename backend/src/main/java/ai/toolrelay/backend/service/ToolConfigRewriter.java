package ai.toolrelay.backend.service;

import ai.toolrelay.backend.service.exception.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Points the entries of a tool definition document at the coordinator.
 *
 * <p>The document has the shape {@code {tools: [{class_name, config, tool_schema}]}}.
 * Each entry gets {@code config.mcp_server_url} from the address table and,
 * when given, {@code config.timeout_per_query}; {@code class_name} may be
 * swapped for a proxy class. The input is never modified.
 */
public final class ToolConfigRewriter {

    static final String TOOLS = "tools";
    static final String CLASS_NAME = "class_name";
    static final String CONFIG = "config";
    static final String SERVER_URL = "mcp_server_url";
    static final String TIMEOUT_PER_QUERY = "timeout_per_query";

    private ToolConfigRewriter() {
    }

    /**
     * @param document          parsed tool definition document
     * @param addresses         tool name to the URL callers should use for it
     * @param timeoutPerQuery   per-query timeout in seconds, null to leave unset
     * @param replacementClass  class name to put on every entry, null to keep the original
     * @return a rewritten deep copy of the document
     * @throws ValidationException if the document is malformed or a tool has no address
     */
    public static Map<String, Object> rewrite(Map<String, Object> document,
                                              Map<String, String> addresses,
                                              Integer timeoutPerQuery,
                                              String replacementClass) {
        Map<String, Object> result = deepCopy(document);

        for (Map<String, Object> entry : toolEntries(result)) {
            String toolName = toolName(entry);
            String address = addresses.get(toolName);
            if (address == null) {
                throw new ValidationException("No address resolved for tool " + toolName);
            }

            Map<String, Object> config = configOf(entry);
            config.put(SERVER_URL, address);
            if (timeoutPerQuery != null) {
                config.put(TIMEOUT_PER_QUERY, timeoutPerQuery);
            }
            if (replacementClass != null && !replacementClass.isBlank()) {
                entry.put(CLASS_NAME, replacementClass);
            }
        }
        return result;
    }

    /**
     * Tool names in document order, each being the last dot-separated segment of its class name.
     */
    public static Set<String> toolNames(Map<String, Object> document) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> entry : toolEntries(document)) {
            names.add(toolName(entry));
        }
        return names;
    }

    /**
     * Builds the address table that sends every tool to the coordinator's routing surface.
     */
    public static Map<String, String> coordinatorAddresses(String publicUrl, Set<String> toolNames) {
        String base = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
        Map<String, String> addresses = new LinkedHashMap<>();
        for (String tool : toolNames) {
            addresses.put(tool, base + "/tools/" + tool);
        }
        return addresses;
    }

    static String toolName(Map<String, Object> entry) {
        Object className = entry.get(CLASS_NAME);
        if (!(className instanceof String) || ((String) className).isBlank()) {
            throw new ValidationException("Tool entry without class_name: " + entry);
        }
        String value = (String) className;
        return value.substring(value.lastIndexOf('.') + 1);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> toolEntries(Map<String, Object> document) {
        Object tools = document == null ? null : document.get(TOOLS);
        if (!(tools instanceof List)) {
            throw new ValidationException("Tool definition document has no 'tools' list");
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Object item : (List<Object>) tools) {
            if (!(item instanceof Map)) {
                throw new ValidationException("Tool entry is not a mapping: " + item);
            }
            entries.add((Map<String, Object>) item);
        }
        return entries;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> configOf(Map<String, Object> entry) {
        Object config = entry.get(CONFIG);
        if (config instanceof Map) {
            return (Map<String, Object>) config;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        entry.put(CONFIG, created);
        return created;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        if (source == null) {
            throw new ValidationException("Tool definition document is empty");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }
}
