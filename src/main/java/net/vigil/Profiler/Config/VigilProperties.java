package net.vigil.Profiler.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the Vigil agent.
 * These properties can be configured in application.properties with the prefix "vigil".
 */
@ConfigurationProperties(prefix = "vigil")
public class VigilProperties {

    public static final String DEFAULT_API_URL = "https://www.vigil.dev/api/v1";

    /**
     * Enable or disable the agent's auto-configuration.
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Backend endpoint traces and errors are posted to.
     */
    private String apiUrl = DEFAULT_API_URL;

    /**
     * Key sent as the basic auth password. Nothing is sent when empty.
     */
    private String apiKey;

    /**
     * Fully-qualified exception class names never reported. Names match exactly,
     * subclasses are still reported.
     */
    private Set<String> ignoreExceptions = new LinkedHashSet<>();

    /**
     * Action names producers should not trace.
     */
    private Set<String> ignoreActions = new LinkedHashSet<>();

    /**
     * Base package (com.acme.shop) or source path (com/acme/shop) of the application.
     * Error and section locations under it are reported relative to it.
     */
    private String appRoot;

    /**
     * Connect and read timeout of the HTTP client.
     * Default: 3 seconds
     */
    private Duration timeout = Duration.ofSeconds(3);

    /**
     * Interval between two flushes of the delivery queue.
     * Default: 10 seconds
     */
    private Duration flushInterval = Duration.ofSeconds(10);

    /**
     * Number of buffered traces of one kind that triggers an immediate flush.
     * Default: 10
     */
    private int flushThreshold = 10;

    /**
     * Number of completed request traces kept for local display.
     * Default: 50
     */
    private int recentRequestsLimit = 50;

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalArgumentException("apiUrl cannot be null or empty");
        }
        this.apiUrl = apiUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Set<String> getIgnoreExceptions() {
        return ignoreExceptions;
    }

    public void setIgnoreExceptions(Set<String> ignoreExceptions) {
        this.ignoreExceptions = ignoreExceptions != null ? ignoreExceptions : new LinkedHashSet<>();
    }

    public Set<String> getIgnoreActions() {
        return ignoreActions;
    }

    public void setIgnoreActions(Set<String> ignoreActions) {
        this.ignoreActions = ignoreActions != null ? ignoreActions : new LinkedHashSet<>();
    }

    public String getAppRoot() {
        return appRoot;
    }

    public void setAppRoot(String appRoot) {
        this.appRoot = appRoot;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.timeout = timeout;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
        if (flushInterval == null || flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("flushInterval must be positive");
        }
        this.flushInterval = flushInterval;
    }

    public int getFlushThreshold() {
        return flushThreshold;
    }

    public void setFlushThreshold(int flushThreshold) {
        if (flushThreshold <= 0) {
            throw new IllegalArgumentException("flushThreshold must be positive");
        }
        this.flushThreshold = flushThreshold;
    }

    public int getRecentRequestsLimit() {
        return recentRequestsLimit;
    }

    public void setRecentRequestsLimit(int recentRequestsLimit) {
        if (recentRequestsLimit < 0) {
            throw new IllegalArgumentException("recentRequestsLimit must not be negative");
        }
        this.recentRequestsLimit = recentRequestsLimit;
    }

    @Override
    public String toString() {
        return "VigilProperties{" +
                "enabled=" + enabled +
                ", apiUrl='" + apiUrl + '\'' +
                ", ignoreExceptions=" + ignoreExceptions +
                ", ignoreActions=" + ignoreActions +
                ", appRoot='" + appRoot + '\'' +
                ", timeout=" + timeout +
                ", flushInterval=" + flushInterval +
                ", flushThreshold=" + flushThreshold +
                ", recentRequestsLimit=" + recentRequestsLimit +
                '}';
    }
}
