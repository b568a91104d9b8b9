package ai.toolrelay.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * On master startup, rewrites the tool definition file named by
 * {@code app.tool-config.source} so that every tool points at this coordinator,
 * and writes the result as YAML.
 */
@Slf4j
@Component
@ConditionalOnExpression("${app.master.enabled:true} and '${app.tool-config.source:}' != ''")
public class ToolConfigExporter implements ApplicationRunner {

    private final WorkerRegistry workerRegistry;
    private final String source;
    private final String output;
    private final String publicUrl;
    private final Integer timeoutPerQuery;
    private final String proxyClass;

    public ToolConfigExporter(
            WorkerRegistry workerRegistry,
            @Value("${app.tool-config.source}") String source,
            @Value("${app.tool-config.output:}") String output,
            @Value("${app.tool-config.public-url:http://localhost:${server.port:8080}}") String publicUrl,
            @Value("${app.tool-config.timeout-per-query:#{null}}") Integer timeoutPerQuery,
            @Value("${app.tool-config.proxy-class:}") String proxyClass) {
        this.workerRegistry = workerRegistry;
        this.source = source;
        this.output = output;
        this.publicUrl = publicUrl;
        this.timeoutPerQuery = timeoutPerQuery;
        this.proxyClass = proxyClass;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path written = export(Path.of(source), resolveOutput());
        log.info("Wrote tool definitions pointing at {} to {}", publicUrl, written);
    }

    /**
     * Reads, rewrites and writes one tool definition document.
     *
     * @return the output path
     */
    public Path export(Path sourcePath, Path outputPath) {
        Map<String, Object> document = read(sourcePath);
        Set<String> tools = ToolConfigRewriter.toolNames(document);
        workerRegistry.declareTools(tools);

        Map<String, Object> rewritten = ToolConfigRewriter.rewrite(
                document,
                ToolConfigRewriter.coordinatorAddresses(publicUrl, tools),
                timeoutPerQuery,
                StringUtils.hasText(proxyClass) ? proxyClass : null);

        write(rewritten, outputPath);
        return outputPath;
    }

    private Path resolveOutput() {
        if (StringUtils.hasText(output)) {
            return Path.of(output);
        }
        Path sourcePath = Path.of(source);
        String fileName = sourcePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return sourcePath.resolveSibling(base + "_with_urls.yaml");
    }

    private static Map<String, Object> read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Object> document = new Yaml().load(reader);
            if (document == null) {
                throw new IllegalStateException("Tool definition file is empty: " + path);
            }
            return document;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tool definitions from " + path, e);
        }
    }

    private static void write(Map<String, Object> document, Path path) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setAllowUnicode(true);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                new Yaml(options).dump(document, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write tool definitions to " + path, e);
        }
    }
}
