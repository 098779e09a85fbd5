package net.vigil.Profiler.Config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import net.vigil.Profiler.Agent;
import net.vigil.Profiler.Aspect.MeasuredAspect;
import net.vigil.Profiler.Delivery.BatchingDeliveryQueue;
import net.vigil.Profiler.Delivery.Client;
import net.vigil.Profiler.Delivery.DeliveryQueue;
import net.vigil.Profiler.Delivery.RestTemplateClient;
import net.vigil.Profiler.Metrics.MetricsRecorder;
import net.vigil.Profiler.Metrics.MicrometerMetricsRecorder;
import net.vigil.Profiler.Metrics.NoOpMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

/**
 * Auto-configuration for the Vigil agent.
 * Provides default beans that users can override if needed.
 *
 * Can be disabled by setting: vigil.enabled=false
 */
@AutoConfiguration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(VigilProperties.class)
@ConditionalOnProperty(
        prefix = "vigil",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class VigilAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(VigilAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MetricsRecorder vigilMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            logger.debug("no MeterRegistry found - vigil metrics disabled");
            return new NoOpMetricsRecorder();
        }
        return new MicrometerMetricsRecorder(registry);
    }

    /**
     * RestTemplate used to reach the backend. Kept private to the agent: the api url is
     * its root URI and the api key its basic auth password.
     */
    @Bean(name = "vigilRestTemplate")
    @ConditionalOnMissingBean(name = "vigilRestTemplate")
    public RestTemplate vigilRestTemplate(VigilProperties properties) {
        // not exposed as a bean so the application's own ObjectMapper stays in charge
        ObjectMapper objectMapper = new ObjectMapper();
        // extra details and job parameters may carry java.time values
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

        RestTemplateBuilder builder = new RestTemplateBuilder()
                .rootUri(properties.getApiUrl())
                .setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .messageConverters(new MappingJackson2HttpMessageConverter(objectMapper));

        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            builder = builder.basicAuthentication("", properties.getApiKey());
        }
        return builder.build();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(Client.class)
    public RestTemplateClient vigilClient(@Qualifier("vigilRestTemplate") RestTemplate vigilRestTemplate,
                                          MetricsRecorder metricsRecorder) {
        // owned by the client, a shared Executor bean would displace Spring Boot's task executor
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("vigil-client-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(3);
        executor.initialize();
        return new RestTemplateClient(vigilRestTemplate, executor, metricsRecorder);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(DeliveryQueue.class)
    public BatchingDeliveryQueue vigilDeliveryQueue(Client client, VigilProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("vigil-queue-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t ->
                LoggerFactory.getLogger("vigil-queue")
                        .error("scheduler error: {}", t.getMessage(), t)
        );
        scheduler.initialize();

        BatchingDeliveryQueue queue = new BatchingDeliveryQueue(client, scheduler, properties);
        queue.start();
        return queue;
    }

    @Bean
    @ConditionalOnMissingBean
    public Agent vigilAgent(VigilProperties properties,
                            DeliveryQueue deliveryQueue,
                            Client client,
                            MetricsRecorder metricsRecorder) {
        return new Agent(properties, deliveryQueue, client, metricsRecorder, Clock.SYSTEM);
    }

    @Bean
    @ConditionalOnMissingBean
    public MeasuredAspect measuredAspect(Agent agent) {
        return new MeasuredAspect(agent);
    }
}
