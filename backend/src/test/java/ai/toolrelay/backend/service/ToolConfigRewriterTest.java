package ai.toolrelay.backend.service;

import ai.toolrelay.backend.service.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolConfigRewriterTest {

    private static final String DOCUMENT = """
            tools:
              - class_name: bootcamps.example.ArithmeticTool
                config:
                  type: native
                tool_schema:
                  type: function
                  function:
                    name: arithmetic
              - class_name: bootcamps.search.SearchTool
            """;

    private Map<String, Object> load() {
        return new Yaml().load(DOCUMENT);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> entry(Map<String, Object> document, int index) {
        return ((List<Map<String, Object>>) document.get("tools")).get(index);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> config(Map<String, Object> entry) {
        return (Map<String, Object>) entry.get("config");
    }

    @Test
    void toolNameIsLastSegmentOfClassName() {
        assertThat(ToolConfigRewriter.toolNames(load())).containsExactly("ArithmeticTool", "SearchTool");
    }

    @Test
    void addsServerUrlAndTimeoutToEveryEntry() {
        Map<String, Object> original = load();
        Map<String, String> addresses = ToolConfigRewriter.coordinatorAddresses("http://master:8080/",
                Set.of("ArithmeticTool", "SearchTool"));

        Map<String, Object> rewritten = ToolConfigRewriter.rewrite(original, addresses, 60, null);

        Map<String, Object> first = entry(rewritten, 0);
        assertThat(config(first))
                .containsEntry("type", "native")
                .containsEntry("mcp_server_url", "http://master:8080/tools/ArithmeticTool")
                .containsEntry("timeout_per_query", 60);
        assertThat(first.get("class_name")).isEqualTo("bootcamps.example.ArithmeticTool");
        assertThat(first).containsKey("tool_schema");

        Map<String, Object> second = entry(rewritten, 1);
        assertThat(config(second)).containsEntry("mcp_server_url", "http://master:8080/tools/SearchTool");
    }

    @Test
    void inputDocumentIsLeftUntouched() {
        Map<String, Object> original = load();

        ToolConfigRewriter.rewrite(original,
                Map.of("ArithmeticTool", "http://a", "SearchTool", "http://b"), 10, "proxy.ProxyTool");

        assertThat(config(entry(original, 0))).doesNotContainKey("mcp_server_url");
        assertThat(entry(original, 1)).doesNotContainKey("config");
        assertThat(entry(original, 0).get("class_name")).isEqualTo("bootcamps.example.ArithmeticTool");
    }

    @Test
    void optionalFieldsAreOnlySetWhenGiven() {
        Map<String, Object> rewritten = ToolConfigRewriter.rewrite(load(),
                Map.of("ArithmeticTool", "http://a", "SearchTool", "http://b"), null, null);

        assertThat(config(entry(rewritten, 0))).doesNotContainKey("timeout_per_query");

        Map<String, Object> swapped = ToolConfigRewriter.rewrite(load(),
                Map.of("ArithmeticTool", "http://a", "SearchTool", "http://b"), null, "proxy.ProxyTool");
        assertThat(entry(swapped, 0).get("class_name")).isEqualTo("proxy.ProxyTool");
        assertThat(entry(swapped, 1).get("class_name")).isEqualTo("proxy.ProxyTool");
    }

    @Test
    void missingAddressIsRejected() {
        assertThatThrownBy(() -> ToolConfigRewriter.rewrite(load(), Map.of("ArithmeticTool", "http://a"), null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("SearchTool");
    }

    @Test
    void malformedDocumentsAreRejected() {
        assertThatThrownBy(() -> ToolConfigRewriter.toolNames(Map.of("other", 1)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ToolConfigRewriter.toolNames(Map.of("tools", List.of(Map.of("config", Map.of())))))
                .isInstanceOf(ValidationException.class);
    }
}
