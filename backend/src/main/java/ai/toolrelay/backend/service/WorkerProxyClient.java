package ai.toolrelay.backend.service;

import ai.toolrelay.backend.service.exception.WorkerCallFailedException;
import ai.toolrelay.backend.service.exception.WorkerTimeoutException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * HTTP client for the tool endpoints of a worker.
 *
 * Every call goes to {@code {base_url}/{tool}/{operation}} and carries its own
 * read timeout. Transport failures are translated into domain exceptions; a
 * timeout never affects the worker's registry status.
 */
public class WorkerProxyClient {

    private static final Logger logger = LoggerFactory.getLogger(WorkerProxyClient.class);

    private final PerCallTimeoutRequestFactory requestFactory;
    private final RestTemplate restTemplate;

    public WorkerProxyClient(Duration connectTimeout) {
        this.requestFactory = new PerCallTimeoutRequestFactory();
        this.requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        this.restTemplate = new RestTemplate(requestFactory);
    }

    /**
     * Posts a JSON body to a worker and returns the response body unchanged.
     *
     * @param baseUrl   worker base url without trailing slash
     * @param toolName  tool the call is for
     * @param operation create, execute, release or calc_reward
     * @param body      request payload, serialized as JSON
     * @param timeout   read timeout for this call
     * @return parsed response body, an empty object when the worker sent none
     * @throws WorkerTimeoutException    if the worker did not answer in time
     * @throws WorkerCallFailedException if the worker was unreachable, answered
     *                                   with a non-2xx status or reported {@code success: false}
     */
    public JsonNode post(String baseUrl, String toolName, String operation, Object body, Duration timeout) {
        String url = baseUrl + "/" + toolName + "/" + operation;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Object> entity = new HttpEntity<>(body, headers);

        try {
            logger.debug("Forwarding {} to {} (timeout {}ms)", operation, url, timeout.toMillis());
            ResponseEntity<JsonNode> response = withReadTimeout(timeout,
                    () -> restTemplate.postForEntity(url, entity, JsonNode.class));
            JsonNode result = response.getBody() != null ? response.getBody() : JsonNodeFactory.instance.objectNode();

            JsonNode success = result.get("success");
            if (success != null && success.isBoolean() && !success.asBoolean()) {
                throw new WorkerCallFailedException("Worker rejected " + operation + " on " + url + ": "
                        + describeFailure(result));
            }
            return result;

        } catch (ResourceAccessException e) {
            if (hasTimeoutCause(e)) {
                logger.warn("Worker call {} timed out after {}ms", url, timeout.toMillis());
                throw new WorkerTimeoutException("Worker did not answer " + operation + " within "
                        + timeout.toMillis() + "ms: " + url, e);
            }
            logger.warn("Worker at {} unreachable: {}", url, e.getMessage());
            throw new WorkerCallFailedException("Worker unreachable: " + url, e);

        } catch (HttpStatusCodeException e) {
            logger.warn("Worker call {} returned {}: {}", url, e.getStatusCode(), e.getResponseBodyAsString());
            throw new WorkerCallFailedException("Worker returned " + e.getStatusCode().value() + " for "
                    + operation + ": " + e.getResponseBodyAsString(), e);

        } catch (RestClientException e) {
            logger.error("Failed to communicate with worker at {}: {}", url, e.getMessage());
            throw new WorkerCallFailedException("Failed to call worker: " + url, e);
        }
    }

    /**
     * Checks that a worker answers {@code GET {base_url}/health} with a 2xx status.
     */
    public boolean isReachable(String baseUrl, Duration timeout) {
        String url = baseUrl + "/health";
        try {
            ResponseEntity<String> response = withReadTimeout(timeout,
                    () -> restTemplate.getForEntity(url, String.class));
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            logger.warn("Reachability check of {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    RestTemplate getRestTemplate() {
        return restTemplate;
    }

    private <T> T withReadTimeout(Duration timeout, Supplier<T> call) {
        requestFactory.readTimeout.set(timeout);
        try {
            return call.get();
        } finally {
            requestFactory.readTimeout.remove();
        }
    }

    private static boolean hasTimeoutCause(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String describeFailure(JsonNode body) {
        for (String field : new String[]{"error", "message", "result"}) {
            JsonNode value = body.get(field);
            if (value != null && !value.isNull()) {
                return value.isTextual() ? value.asText() : value.toString();
            }
        }
        return "no reason given";
    }

    /**
     * Request factory whose read timeout is taken from the calling thread, so one
     * RestTemplate serves every deadline a caller can ask for.
     */
    static final class PerCallTimeoutRequestFactory extends SimpleClientHttpRequestFactory {

        private final ThreadLocal<Duration> readTimeout = new ThreadLocal<>();

        @Override
        protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
            super.prepareConnection(connection, httpMethod);
            Duration timeout = readTimeout.get();
            if (timeout != null) {
                connection.setReadTimeout((int) Math.min(Math.max(timeout.toMillis(), 1), Integer.MAX_VALUE));
            }
        }
    }
}
