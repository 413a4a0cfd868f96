package com.arrowlog.exporter.config;

import com.arrowlog.exporter.upload.RetryPolicy;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of one exporter node: where batches go, the identity they are uploaded under and how uploads are batched
 * and retried.
 */
public final class ExporterConfig {
    public static final int DEFAULT_CONFIG_MAJOR_VERSION = 1;
    public static final int DEFAULT_MAX_RECORDS_PER_BATCH = 1000;

    private final String endpoint;
    private final String environment;
    private final String account;
    private final String namespace;
    private final String region;
    private final int configMajorVersion;
    private final String tenant;
    private final String roleName;
    private final String roleInstance;
    private final int maxRecordsPerBatch;
    private final RetryPolicy batchRetry;

    private ExporterConfig(Builder b) {
        this.endpoint = b.endpoint;
        this.environment = b.environment;
        this.account = b.account;
        this.namespace = b.namespace;
        this.region = b.region;
        this.configMajorVersion = b.configMajorVersion;
        this.tenant = b.tenant;
        this.roleName = b.roleName;
        this.roleInstance = b.roleInstance;
        this.maxRecordsPerBatch = b.maxRecordsPerBatch;
        this.batchRetry = b.batchRetry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Throws {@link ExporterConfigException} naming the first missing or invalid field; returns {@code this}. */
    public ExporterConfig validate() {
        require("endpoint", endpoint);
        try {
            URI uri = new URI(endpoint);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ExporterConfigException("endpoint", "must be an http(s) URL but was " + endpoint);
            }
            if (uri.getHost() == null) {
                throw new ExporterConfigException("endpoint", "has no host: " + endpoint);
            }
        } catch (URISyntaxException e) {
            throw new ExporterConfigException("endpoint", "is not a valid URL: " + e.getMessage());
        }
        require("environment", environment);
        require("account", account);
        require("namespace", namespace);
        require("region", region);
        if (configMajorVersion <= 0) {
            throw new ExporterConfigException("configMajorVersion", "must be > 0 but was " + configMajorVersion);
        }
        require("tenant", tenant);
        require("roleName", roleName);
        require("roleInstance", roleInstance);
        if (maxRecordsPerBatch <= 0) {
            throw new ExporterConfigException("maxRecordsPerBatch", "must be > 0 but was " + maxRecordsPerBatch);
        }
        if (batchRetry == null) {
            throw new ExporterConfigException("batchRetry", "is required");
        }
        return this;
    }

    /** Identity fields stamped on every encoded record. */
    public Map<String, String> commonFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("env_name", environment);
        fields.put("env_ver", Integer.toString(configMajorVersion));
        fields.put("env_cloud_role", roleName);
        fields.put("env_cloud_roleInstance", roleInstance);
        return fields;
    }

    private static void require(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ExporterConfigException(field, "is required");
        }
    }

    public String endpoint() {
        return endpoint;
    }

    public String environment() {
        return environment;
    }

    public String account() {
        return account;
    }

    public String namespace() {
        return namespace;
    }

    public String region() {
        return region;
    }

    public int configMajorVersion() {
        return configMajorVersion;
    }

    public String tenant() {
        return tenant;
    }

    public String roleName() {
        return roleName;
    }

    public String roleInstance() {
        return roleInstance;
    }

    public int maxRecordsPerBatch() {
        return maxRecordsPerBatch;
    }

    public RetryPolicy batchRetry() {
        return batchRetry;
    }

    @Override
    public String toString() {
        return "ExporterConfig{endpoint=" + endpoint
                + ", environment=" + environment
                + ", account=" + account
                + ", namespace=" + namespace
                + ", region=" + region
                + ", configMajorVersion=" + configMajorVersion
                + ", tenant=" + tenant
                + ", roleName=" + roleName
                + ", roleInstance=" + roleInstance
                + ", maxRecordsPerBatch=" + maxRecordsPerBatch
                + ", batchRetry=" + batchRetry
                + '}';
    }

    public static final class Builder {
        private String endpoint;
        private String environment;
        private String account;
        private String namespace;
        private String region;
        private int configMajorVersion = DEFAULT_CONFIG_MAJOR_VERSION;
        private String tenant;
        private String roleName;
        private String roleInstance;
        private int maxRecordsPerBatch = DEFAULT_MAX_RECORDS_PER_BATCH;
        private RetryPolicy batchRetry = RetryPolicy.defaults();

        private Builder() {}

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder configMajorVersion(int configMajorVersion) {
            this.configMajorVersion = configMajorVersion;
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder roleName(String roleName) {
            this.roleName = roleName;
            return this;
        }

        public Builder roleInstance(String roleInstance) {
            this.roleInstance = roleInstance;
            return this;
        }

        public Builder maxRecordsPerBatch(int maxRecordsPerBatch) {
            this.maxRecordsPerBatch = maxRecordsPerBatch;
            return this;
        }

        public Builder batchRetry(RetryPolicy batchRetry) {
            this.batchRetry = batchRetry;
            return this;
        }

        public ExporterConfig build() {
            return new ExporterConfig(this);
        }
    }
}
