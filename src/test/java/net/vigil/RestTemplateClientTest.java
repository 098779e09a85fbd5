package net.vigil;

import net.vigil.Profiler.CustomObject.Trace;
import net.vigil.Profiler.CustomObject.TraceKind;
import net.vigil.Profiler.Delivery.RestTemplateClient;
import net.vigil.Profiler.Metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@ExtendWith(MockitoExtension.class)
class RestTemplateClientTest {

    private static final String API_URL = "https://api.vigil.test/api/v1";

    @Mock
    private MetricsRecorder metricsRecorder;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplateBuilder().rootUri(API_URL).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private static Trace job(String name) {
        Trace trace = new Trace(name, TraceKind.JOB, 0.0);
        trace.stop(3.0);
        return trace;
    }

    @Test
    void testPostSendsJsonToPathUnderApiUrl() {
        // Given
        server.expect(requestTo(API_URL + "/jobs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.jobs[0].name").value("NightlyReport"))
                .andExpect(jsonPath("$.jobs[0].kind").value("job"))
                .andExpect(jsonPath("$.jobs[0].runtime").value(3.0))
                .andRespond(withSuccess());
        RestTemplateClient client = new RestTemplateClient(restTemplate, Runnable::run, metricsRecorder);

        // When
        client.post("/jobs", Map.of("jobs", List.of(job("NightlyReport"))));

        // Then
        server.verify();
        verifyNoInteractions(metricsRecorder);
    }

    @Test
    void testServerErrorIsLoggedNotThrown() {
        server.expect(requestTo(API_URL + "/requests"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        RestTemplateClient client = new RestTemplateClient(restTemplate, Runnable::run, metricsRecorder);

        assertDoesNotThrow(() -> client.post("/requests", Map.of("requests", List.of())));

        server.verify();
        verify(metricsRecorder).recordDeliveryFailure("/requests");
    }

    @Test
    void testPostAsyncRunsOnExecutor() {
        server.expect(requestTo(API_URL + "/errors"))
                .andExpect(jsonPath("$.error").value("payload"))
                .andRespond(withSuccess());
        Executor executor = mock(Executor.class);
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(executor).execute(any(Runnable.class));
        RestTemplateClient client = new RestTemplateClient(restTemplate, executor, metricsRecorder);

        client.postAsync("/errors", Map.of("error", "payload"));

        verify(executor).execute(any(Runnable.class));
        server.verify();
    }

    @Test
    void testRejectedAsyncPostIsDropped() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        RestTemplateClient client = new RestTemplateClient(restTemplate, saturated, metricsRecorder);

        assertDoesNotThrow(() -> client.postAsync("/errors", Map.of("error", "payload")));

        verify(metricsRecorder).recordDeliveryFailure("/errors");
    }
}
