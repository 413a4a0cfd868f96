package com.arrowlog.transport.okhttp;

import java.util.Objects;

/**
 * Where and as whom batches are ingested. Every field except {@code tenant}, {@code roleName} and
 * {@code roleInstance} is required.
 */
public record IngestionTarget(
        String endpoint,
        String namespace,
        String environment,
        String region,
        int configVersion,
        String account,
        String tenant,
        String roleName,
        String roleInstance) {

    public IngestionTarget {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(account, "account");
        while (endpoint.endsWith("/")) endpoint = endpoint.substring(0, endpoint.length() - 1);
    }
}
