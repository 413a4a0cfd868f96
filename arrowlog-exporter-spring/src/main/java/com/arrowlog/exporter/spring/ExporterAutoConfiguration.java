package com.arrowlog.exporter.spring;

import com.arrowlog.exporter.config.ExporterConfig;
import com.arrowlog.exporter.encode.JsonLinesLogBatchEncoder;
import com.arrowlog.exporter.encode.LogBatchEncoder;
import com.arrowlog.exporter.metrics.ExporterMetrics;
import com.arrowlog.exporter.node.LogExporter;
import com.arrowlog.exporter.node.LoggingSignalAcknowledger;
import com.arrowlog.exporter.node.MessageChannel;
import com.arrowlog.exporter.node.SignalAcknowledger;
import com.arrowlog.transport.BatchUploader;
import com.arrowlog.transport.okhttp.OkHttpBatchUploader;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(ExporterProperties.class)
@ConditionalOnProperty(prefix = "arrowlog.exporter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExporterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ExporterConfig arrowlogExporterConfig(ExporterProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public OkHttpClient arrowlogOkHttpClient() {
        return OkHttpBatchUploader.defaultClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchUploader arrowlogBatchUploader(OkHttpClient client, ExporterConfig config) {
        return new OkHttpBatchUploader(client, ExporterProperties.toTarget(config));
    }

    @Bean
    @ConditionalOnMissingBean
    public LogBatchEncoder arrowlogLogBatchEncoder(ExporterConfig config, ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonLinesLogBatchEncoder(
                objectMapper.getIfAvailable(ObjectMapper::new), config.maxRecordsPerBatch(), config.commonFields());
    }

    @Bean
    @ConditionalOnMissingBean
    public SignalAcknowledger arrowlogSignalAcknowledger() {
        return new LoggingSignalAcknowledger();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExporterMetrics arrowlogExporterMetrics() {
        return new ExporterMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageChannel arrowlogMessageChannel() {
        return new MessageChannel();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogExporter arrowlogLogExporter(
            ExporterProperties properties,
            ExporterConfig config,
            LogBatchEncoder encoder,
            BatchUploader uploader,
            SignalAcknowledger acknowledger,
            ExporterMetrics metrics) {
        return LogExporter.builder()
                .name(properties.getName())
                .encoder(encoder)
                .uploader(uploader)
                .retryPolicy(config.batchRetry())
                .acknowledger(acknowledger)
                .metrics(metrics)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExporterLifecycle arrowlogExporterLifecycle(
            LogExporter exporter, MessageChannel channel, ExporterProperties properties) {
        return new ExporterLifecycle(exporter, channel, properties.getShutdownTimeout());
    }
}
