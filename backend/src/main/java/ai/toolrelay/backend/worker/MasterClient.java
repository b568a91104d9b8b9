package ai.toolrelay.backend.worker;

import ai.toolrelay.backend.model.dto.RegisterWorkerRequest;
import ai.toolrelay.backend.model.dto.RegisterWorkerResponse;
import ai.toolrelay.backend.service.exception.UnknownWorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the master's worker-facing endpoints.
 */
public class MasterClient {

    private static final Logger logger = LoggerFactory.getLogger(MasterClient.class);

    private final RestTemplate restTemplate;
    private volatile String masterUrl;

    /**
     * @param masterUrl master address; blank means the master runs in this
     *                  process and is addressed once its port is known
     */
    public MasterClient(RestTemplate restTemplate, String masterUrl) {
        this.restTemplate = restTemplate;
        this.masterUrl = StringUtils.hasText(masterUrl) ? trimSlash(masterUrl.trim()) : null;
    }

    /**
     * Points a client without a configured master at the local server.
     */
    public void useLocalMasterIfUnset(int serverPort) {
        if (masterUrl == null) {
            masterUrl = "http://localhost:" + serverPort;
        }
    }

    /**
     * Registers this worker.
     *
     * @return the response carrying the effective worker id
     * @throws MasterUnavailableException if the master is down or refused the registration
     */
    public RegisterWorkerResponse register(RegisterWorkerRequest request) {
        String url = masterUrl + "/register";
        try {
            logger.debug("Registering with master at {}", url);
            ResponseEntity<RegisterWorkerResponse> response =
                    restTemplate.postForEntity(url, request, RegisterWorkerResponse.class);
            if (response.getBody() == null || response.getBody().getWorkerId() == null) {
                throw new MasterUnavailableException("Master returned no worker id");
            }
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            throw new MasterUnavailableException("Registration rejected with " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new MasterUnavailableException("Master unreachable at " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws UnknownWorkerException     if the master no longer knows this worker
     * @throws MasterUnavailableException on any other failure
     */
    public void heartbeat(String workerId) {
        String url = masterUrl + "/heartbeat/" + workerId;
        try {
            restTemplate.put(url, null);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new UnknownWorkerException("Master does not know worker " + workerId);
            }
            throw new MasterUnavailableException("Heartbeat rejected with " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new MasterUnavailableException("Master unreachable at " + url + ": " + e.getMessage(), e);
        }
    }

    public void unregister(String workerId) {
        String url = masterUrl + "/workers/" + workerId;
        try {
            restTemplate.delete(url);
        } catch (RestClientException e) {
            throw new MasterUnavailableException("Failed to unregister " + workerId + ": " + e.getMessage(), e);
        }
    }

    public String getMasterUrl() {
        return masterUrl;
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
