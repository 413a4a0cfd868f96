package com.arrowlog.exporter.spring;

import com.arrowlog.exporter.config.ExporterConfig;
import com.arrowlog.exporter.upload.RetryPolicy;
import com.arrowlog.transport.okhttp.IngestionTarget;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the Arrowlog log exporter.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * arrowlog:
 *   exporter:
 *     endpoint: https://ingest.example.com
 *     environment: prod
 *     account: acme
 *     namespace: checkout
 *     region: eu-west-1
 *     tenant: t-1
 *     role-name: checkout-api
 *     role-instance: ${HOSTNAME}
 *     max-records-per-batch: 1000
 *     retry:
 *       max-retries: 3
 *       initial-interval: 100ms
 *       max-interval: 5s
 *       multiplier: 2.0
 * }</pre>
 */
@ConfigurationProperties(prefix = "arrowlog.exporter")
public class ExporterProperties {

    /** Master switch; when {@code false} no exporter beans are created. */
    private boolean enabled = true;

    /** Exporter node name, used for its worker thread and in logs. */
    private String name = "default";

    private String endpoint;
    private String environment;
    private String account;
    private String namespace;
    private String region;
    private int configMajorVersion = ExporterConfig.DEFAULT_CONFIG_MAJOR_VERSION;
    private String tenant;
    private String roleName;
    private String roleInstance;
    private int maxRecordsPerBatch = ExporterConfig.DEFAULT_MAX_RECORDS_PER_BATCH;

    /** How long the application waits for the exporter to drain when the context stops. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private final Retry retry = new Retry();

    /** Validated exporter configuration built from these properties. */
    public ExporterConfig toConfig() {
        return ExporterConfig.builder()
                .endpoint(endpoint)
                .environment(environment)
                .account(account)
                .namespace(namespace)
                .region(region)
                .configMajorVersion(configMajorVersion)
                .tenant(tenant)
                .roleName(roleName)
                .roleInstance(roleInstance)
                .maxRecordsPerBatch(maxRecordsPerBatch)
                .batchRetry(retry.toPolicy())
                .build()
                .validate();
    }

    public static IngestionTarget toTarget(ExporterConfig config) {
        return new IngestionTarget(
                config.endpoint(),
                config.namespace(),
                config.environment(),
                config.region(),
                config.configMajorVersion(),
                config.account(),
                config.tenant(),
                config.roleName(),
                config.roleInstance());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public int getConfigMajorVersion() {
        return configMajorVersion;
    }

    public void setConfigMajorVersion(int configMajorVersion) {
        this.configMajorVersion = configMajorVersion;
    }

    public String getTenant() {
        return tenant;
    }

    public void setTenant(String tenant) {
        this.tenant = tenant;
    }

    public String getRoleName() {
        return roleName;
    }

    public void setRoleName(String roleName) {
        this.roleName = roleName;
    }

    public String getRoleInstance() {
        return roleInstance;
    }

    public void setRoleInstance(String roleInstance) {
        this.roleInstance = roleInstance;
    }

    public int getMaxRecordsPerBatch() {
        return maxRecordsPerBatch;
    }

    public void setMaxRecordsPerBatch(int maxRecordsPerBatch) {
        this.maxRecordsPerBatch = maxRecordsPerBatch;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Retry getRetry() {
        return retry;
    }

    /** Backoff applied to every batch upload. */
    public static class Retry {

        private boolean enabled = true;
        private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
        private Duration initialInterval = RetryPolicy.DEFAULT_INITIAL_INTERVAL;

        /** Upper bound on any single wait; {@code 0} leaves waits unbounded. */
        private Duration maxInterval = RetryPolicy.DEFAULT_MAX_INTERVAL;

        private double multiplier = RetryPolicy.DEFAULT_MULTIPLIER;

        RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries, initialInterval, maxInterval, multiplier, enabled);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
        }

        public Duration getMaxInterval() {
            return maxInterval;
        }

        public void setMaxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }
}
