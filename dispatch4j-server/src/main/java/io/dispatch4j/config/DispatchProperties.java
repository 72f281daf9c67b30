package io.dispatch4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the dispatcher.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {
    private String endpoint; // receiver of every callback
    private String secret; // shared both ways
    private Duration callbackTimeout = Duration.ofSeconds(10);
    private int cronThreads = 4;
    private String cronTimezone; // null = system default
    private boolean ensureIndexesOnStartup = true;
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public Duration getCallbackTimeout() {
        return callbackTimeout;
    }

    public void setCallbackTimeout(Duration callbackTimeout) {
        this.callbackTimeout = callbackTimeout;
    }

    public int getCronThreads() {
        return cronThreads;
    }

    public void setCronThreads(int cronThreads) {
        this.cronThreads = cronThreads;
    }

    public String getCronTimezone() {
        return cronTimezone;
    }

    public void setCronTimezone(String cronTimezone) {
        this.cronTimezone = cronTimezone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
