package net.vigil;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.vigil.Profiler.Agent;
import net.vigil.Profiler.Aspect.MeasuredAspect;
import net.vigil.Profiler.Config.VigilAutoConfiguration;
import net.vigil.Profiler.Config.VigilProperties;
import net.vigil.Profiler.Delivery.BatchingDeliveryQueue;
import net.vigil.Profiler.Delivery.Client;
import net.vigil.Profiler.Delivery.DeliveryQueue;
import net.vigil.Profiler.Delivery.RestTemplateClient;
import net.vigil.Profiler.Metrics.MetricsRecorder;
import net.vigil.Profiler.Metrics.MicrometerMetricsRecorder;
import net.vigil.Profiler.Metrics.NoOpMetricsRecorder;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class VigilAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(VigilAutoConfiguration.class));

    @Test
    void testDefaultBeansAreRegistered() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Agent.class);
            assertThat(context).hasSingleBean(MeasuredAspect.class);
            assertThat(context).hasSingleBean(BatchingDeliveryQueue.class);
            assertThat(context).hasSingleBean(RestTemplateClient.class);
            assertThat(context).getBean(MetricsRecorder.class).isInstanceOf(NoOpMetricsRecorder.class);
            assertThat(context.getBean(VigilProperties.class).getApiUrl()).isEqualTo(VigilProperties.DEFAULT_API_URL);
        });
    }

    @Test
    void testMeterRegistryEnablesMicrometerRecorder() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context).getBean(MetricsRecorder.class)
                        .isInstanceOf(MicrometerMetricsRecorder.class));
    }

    @Test
    void testDisabledAgentRegistersNothing() {
        contextRunner
                .withPropertyValues("vigil.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Agent.class);
                    assertThat(context).doesNotHaveBean(DeliveryQueue.class);
                    assertThat(context).doesNotHaveBean(Client.class);
                });
    }

    @Test
    void testPropertiesAreBound() {
        contextRunner
                .withPropertyValues(
                        "vigil.app-root=com.acme.shop",
                        "vigil.ignore-exceptions=java.io.IOException,java.util.concurrent.TimeoutException",
                        "vigil.ignore-actions=HealthController#ping",
                        "vigil.flush-interval=5s",
                        "vigil.flush-threshold=25",
                        "vigil.recent-requests-limit=5",
                        "vigil.timeout=1500ms")
                .run(context -> {
                    VigilProperties properties = context.getBean(VigilProperties.class);
                    assertThat(properties.getAppRoot()).isEqualTo("com.acme.shop");
                    assertThat(properties.getIgnoreExceptions())
                            .containsExactly("java.io.IOException", "java.util.concurrent.TimeoutException");
                    assertThat(properties.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getFlushThreshold()).isEqualTo(25);
                    assertThat(properties.getRecentRequestsLimit()).isEqualTo(5);
                    assertThat(properties.getTimeout()).isEqualTo(Duration.ofMillis(1500));

                    Agent agent = context.getBean(Agent.class);
                    assertThat(agent.isIgnoredException(new IOException())).isTrue();
                    assertThat(agent.isIgnoredException(new FileNotFoundException())).isFalse();
                    assertThat(agent.isIgnoredAction("HealthController#ping")).isTrue();
                });
    }

    @Test
    void testInvalidPropertyFailsStartup() {
        contextRunner
                .withPropertyValues("vigil.flush-threshold=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void testUserDeliveryQueueReplacesDefault() {
        DeliveryQueue custom = mock(DeliveryQueue.class);

        contextRunner
                .withBean(DeliveryQueue.class, () -> custom)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(BatchingDeliveryQueue.class);
                    assertThat(context.getBean(Agent.class).getQueue()).isSameAs(custom);
                });
    }

    @Test
    void testClientPostsToApiUrlWithApiKey() {
        contextRunner
                .withPropertyValues(
                        "vigil.api-url=https://api.vigil.test/api/v1",
                        "vigil.api-key=secret-key")
                .run(context -> {
                    RestTemplate restTemplate = context.getBean("vigilRestTemplate", RestTemplate.class);
                    MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
                    server.expect(requestTo("https://api.vigil.test/api/v1/jobs"))
                            .andExpect(method(HttpMethod.POST))
                            .andExpect(header("Authorization", "Basic OnNlY3JldC1rZXk="))
                            .andRespond(withSuccess());

                    context.getBean(Client.class).post("/jobs", Map.of("jobs", List.of()));

                    server.verify();
                });
    }
}
