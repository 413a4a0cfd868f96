package com.arrowlog.transport.okhttp;

import com.arrowlog.transport.BatchUploader;
import com.arrowlog.transport.EncodedBatch;
import java.io.IOException;
import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.Objects;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OkHttp-based uploader. Each batch is one blocking {@code POST} to the ingestion path; credentials are whatever the
 * injected client's interceptors add.
 */
public class OkHttpBatchUploader implements BatchUploader {
    private static final Logger log = LoggerFactory.getLogger(OkHttpBatchUploader.class);

    public static final String INGEST_PATH = "api/v1/ingestion/ingest";
    public static final String ACCOUNT_HEADER = "X-Arrowlog-Account";
    public static final String TENANT_HEADER = "X-Arrowlog-Tenant";
    public static final String ROLE_HEADER = "X-Arrowlog-Role";
    public static final String ROLE_INSTANCE_HEADER = "X-Arrowlog-Role-Instance";

    private static final MediaType DEFAULT_TYPE = MediaType.get("application/octet-stream");
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final OkHttpClient client;
    private final IngestionTarget target;
    private final HttpUrl ingestUrl;

    public OkHttpBatchUploader(OkHttpClient client, IngestionTarget target) {
        this.client = Objects.requireNonNull(client, "client");
        this.target = Objects.requireNonNull(target, "target");
        HttpUrl base = HttpUrl.parse(target.endpoint());
        if (base == null) throw new IllegalArgumentException("Invalid ingestion endpoint " + target.endpoint());
        this.ingestUrl = base.newBuilder().addPathSegments(INGEST_PATH).build();
    }

    /** Client without credentials that tries IPv4 addresses first. */
    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder().dns(PREFER_IPV4_DNS).build();
    }

    @Override
    public void upload(EncodedBatch batch) throws IOException {
        HttpUrl url = ingestUrl.newBuilder()
                .addQueryParameter("namespace", target.namespace())
                .addQueryParameter("event", batch.eventName())
                .addQueryParameter("environment", target.environment())
                .addQueryParameter("region", target.region())
                .addQueryParameter("version", Integer.toString(target.configVersion()))
                .addQueryParameter("records", Integer.toString(batch.recordCount()))
                .build();
        MediaType type = batch.contentType() != null ? MediaType.parse(batch.contentType()) : null;
        Request.Builder request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(batch.data(), type != null ? type : DEFAULT_TYPE))
                .header(ACCOUNT_HEADER, target.account());
        if (batch.contentEncoding() != null) request.header("Content-Encoding", batch.contentEncoding());
        if (target.tenant() != null) request.header(TENANT_HEADER, target.tenant());
        if (target.roleName() != null) request.header(ROLE_HEADER, target.roleName());
        if (target.roleInstance() != null) request.header(ROLE_INSTANCE_HEADER, target.roleInstance());
        Request req = request.build();

        log.debug("Uploading {} to {} {}", batch, req.method(), url.redact());
        try (Response r = client.newCall(req).execute()) {
            String responseBody = r.body() != null ? r.body().string() : "";
            if (!r.isSuccessful()) {
                log.warn(
                        "Upload {} {} failed with status {} and body: {}",
                        req.method(),
                        url.redact(),
                        r.code(),
                        responseBody);
                throw new IOException("HTTP " + r.code() + " - " + responseBody);
            }
            if (log.isDebugEnabled()) {
                log.debug("Upload of {} succeeded with status {}", batch, r.code());
            }
        }
    }

    @Override
    public void close() {
        client.connectionPool().evictAll();
    }
}
