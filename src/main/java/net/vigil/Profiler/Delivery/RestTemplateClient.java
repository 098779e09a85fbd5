package net.vigil.Profiler.Delivery;

import net.vigil.Profiler.Metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link Client} posting JSON with Spring's RestTemplate.
 *
 * The RestTemplate is expected to carry the api url as root URI, the credentials and
 * the timeouts; see the auto-configuration.
 */
public class RestTemplateClient implements Client {

    private static final Logger logger = LoggerFactory.getLogger(RestTemplateClient.class);

    private final RestTemplate restTemplate;
    private final Executor executor;
    private final MetricsRecorder metricsRecorder;

    public RestTemplateClient(RestTemplate restTemplate, Executor executor, MetricsRecorder metricsRecorder) {
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.metricsRecorder = metricsRecorder;
    }

    @Override
    public void post(String path, Object payload) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            restTemplate.postForEntity(path, new HttpEntity<>(payload, headers), Void.class);
            logger.debug("posted payload to {}", path);
        } catch (Exception e) {
            logger.error("failed to post to {}: {}", path, e.getMessage());
            metricsRecorder.recordDeliveryFailure(path);
        }
    }

    @Override
    public void postAsync(String path, Object payload) {
        try {
            executor.execute(() -> post(path, payload));
        } catch (RejectedExecutionException e) {
            logger.warn("dropped payload for {}, client executor rejected it: {}", path, e.getMessage());
            metricsRecorder.recordDeliveryFailure(path);
        }
    }

    /**
     * Stops the executor used by {@link #postAsync} when this client owns it.
     */
    public void shutdown() {
        if (executor instanceof ExecutorConfigurationSupport support) {
            support.shutdown();
        }
    }
}
