package ai.toolrelay.backend.controller;

import ai.toolrelay.backend.model.registry.RegistrySnapshot;
import ai.toolrelay.backend.model.registry.WorkerRecord;
import ai.toolrelay.backend.service.WorkerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Human-readable overview of workers and tools, refreshed by the browser.
 */
@RestController
@ConditionalOnProperty(name = "app.master.enabled", havingValue = "true", matchIfMissing = true)
public class DashboardController {

    private final WorkerRegistry workerRegistry;

    public DashboardController(WorkerRegistry workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    /**
     * Renders the registry snapshot as a self-refreshing HTML page.
     */
    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String dashboard() {
        RegistrySnapshot snapshot = workerRegistry.snapshot();

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\">")
                .append("<meta http-equiv=\"refresh\" content=\"10\">")
                .append("<title>Tool Relay Dashboard</title>")
                .append("<style>")
                .append("body{font-family:sans-serif;margin:2em;background:#f6f7f9}")
                .append(".card{background:#fff;border-radius:6px;padding:1em;margin:0.5em 0;box-shadow:0 1px 3px #0002}")
                .append(".ONLINE{color:#1a7f37}.OFFLINE{color:#cf222e}")
                .append("table{border-collapse:collapse}td,th{padding:4px 12px;text-align:left}")
                .append("</style></head><body>");

        html.append("<h1>Tool Relay</h1>")
                .append("<p>Workers online: ").append(snapshot.getOnlineWorkerCount())
                .append(" / ").append(snapshot.getWorkers().size())
                .append(" &middot; Bound instances: ").append(snapshot.getBoundInstanceCount())
                .append(" &middot; Updated: ").append(snapshot.getTakenAt()).append("</p>");

        html.append("<h2>Workers</h2>");
        if (snapshot.getWorkers().isEmpty()) {
            html.append("<p>No workers registered.</p>");
        }
        for (WorkerRecord worker : snapshot.getWorkers()) {
            long ageSeconds = worker.getLastHeartbeatAt() == null ? -1
                    : Duration.between(worker.getLastHeartbeatAt(), snapshot.getTakenAt()).toSeconds();
            html.append("<div class=\"card\">")
                    .append("<h3>").append(escape(worker.getWorkerId())).append(" <span class=\"")
                    .append(worker.getStatus()).append("\">").append(worker.getStatus()).append("</span></h3>")
                    .append("<table>")
                    .append(row("URL", escape(worker.getBaseUrl())))
                    .append(row("Tools", escape(String.join(", ", worker.getSupportedTools()))))
                    .append(row("Active instances", String.valueOf(worker.getActiveInstanceCount())))
                    .append(row("Last heartbeat", ageSeconds < 0 ? "never" : ageSeconds + "s ago"))
                    .append(row("Host", escape(describeHost(worker.getHostInfo()))))
                    .append("</table></div>");
        }

        html.append("<h2>Tools</h2><table><tr><th>Tool</th><th>Available workers</th></tr>");
        for (String tool : snapshot.getKnownTools()) {
            Set<String> workers = snapshot.getToolIndex().getOrDefault(tool, Set.of());
            html.append("<tr><td>").append(escape(tool)).append("</td><td>").append(workers.size()).append("</td></tr>");
        }
        html.append("</table></body></html>");
        return html.toString();
    }

    private static String row(String label, String value) {
        return "<tr><th>" + label + "</th><td>" + value + "</td></tr>";
    }

    private static String describeHost(Map<String, Object> hostInfo) {
        if (hostInfo == null || hostInfo.isEmpty()) {
            return "-";
        }
        Object hostname = hostInfo.getOrDefault("hostname", "?");
        Object ip = hostInfo.get("ip");
        return ip == null ? String.valueOf(hostname) : hostname + " (" + ip + ")";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
