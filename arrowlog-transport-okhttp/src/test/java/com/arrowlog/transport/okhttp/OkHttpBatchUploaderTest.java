package com.arrowlog.transport.okhttp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arrowlog.transport.EncodedBatch;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpBatchUploaderTest {

    private static final EncodedBatch BATCH =
            new EncodedBatch("OrderPlaced", new byte[] {31, -117, 8, 0}, 12, "application/x-ndjson", "gzip");

    private final OkHttpClient client = new OkHttpClient.Builder()
            .addInterceptor(chain -> chain.proceed(
                    chain.request().newBuilder().header("Authorization", "Bearer token-1").build()))
            .build();
    private MockWebServer server;
    private OkHttpBatchUploader uploader;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String endpoint = server.url("/").toString();
        uploader = new OkHttpBatchUploader(
                client,
                new IngestionTarget(endpoint, "checkout", "prod", "eu-west-1", 3, "acme", "t-1", "api", "pod-0"));
    }

    @AfterEach
    void tearDown() throws IOException {
        uploader.close();
        server.shutdown();
    }

    @Test
    void postsBatchWithIdentityQueryAndHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202));

        uploader.upload(BATCH);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        HttpUrl url = request.getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/api/v1/ingestion/ingest");
        assertThat(url.queryParameter("namespace")).isEqualTo("checkout");
        assertThat(url.queryParameter("event")).isEqualTo("OrderPlaced");
        assertThat(url.queryParameter("environment")).isEqualTo("prod");
        assertThat(url.queryParameter("region")).isEqualTo("eu-west-1");
        assertThat(url.queryParameter("version")).isEqualTo("3");
        assertThat(url.queryParameter("records")).isEqualTo("12");
        assertThat(request.getHeader("Content-Type")).startsWith("application/x-ndjson");
        assertThat(request.getHeader("Content-Encoding")).isEqualTo("gzip");
        assertThat(request.getHeader(OkHttpBatchUploader.ACCOUNT_HEADER)).isEqualTo("acme");
        assertThat(request.getHeader(OkHttpBatchUploader.TENANT_HEADER)).isEqualTo("t-1");
        assertThat(request.getHeader(OkHttpBatchUploader.ROLE_HEADER)).isEqualTo("api");
        assertThat(request.getHeader(OkHttpBatchUploader.ROLE_INSTANCE_HEADER)).isEqualTo("pod-0");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token-1");
        assertThat(request.getBody().readByteArray()).containsExactly(BATCH.data());
    }

    @Test
    void nonSuccessStatusBecomesIOExceptionWithBody() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("throttled"));

        assertThatThrownBy(() -> uploader.upload(BATCH))
                .isInstanceOf(IOException.class)
                .hasMessage("HTTP 503 - throttled");
    }

    @Test
    void trailingSlashOnEndpointIsIgnored() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        OkHttpBatchUploader slashed = new OkHttpBatchUploader(
                client,
                new IngestionTarget(
                        server.url("/base/").toString(), "ns", "dev", "local", 1, "acme", null, null, null));

        slashed.upload(BATCH);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/base/api/v1/ingestion/ingest");
        assertThat(request.getHeader(OkHttpBatchUploader.TENANT_HEADER)).isNull();
    }

    @Test
    void defaultClientReachesTheServer() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        OkHttpBatchUploader plain = new OkHttpBatchUploader(
                OkHttpBatchUploader.defaultClient(),
                new IngestionTarget(server.url("/").toString(), "ns", "dev", "local", 1, "acme", null, null, null));

        plain.upload(BATCH);
        plain.close();

        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getHeader("Authorization")).isNull();
    }

    @Test
    void rejectsUnparseableEndpoint() {
        IngestionTarget target = new IngestionTarget("not a url", "ns", "dev", "local", 1, "acme", null, null, null);

        assertThatThrownBy(() -> new OkHttpBatchUploader(client, target)).isInstanceOf(IllegalArgumentException.class);
    }
}
