package com.arrowlog.exporter.encode;

import com.arrowlog.logs.model.LogAttribute;
import com.arrowlog.logs.model.LogRecord;
import com.arrowlog.transport.EncodedBatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.logs.Severity;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPOutputStream;

/**
 * Newline-delimited JSON encoder, one object per log record, gzip-compressed.
 *
 * <p>Records are grouped by event name ({@value #DEFAULT_EVENT_NAME} when absent), groups in first-seen order, and
 * each group is cut into batches of at most {@code maxRecordsPerBatch} records. Every line carries the configured
 * common fields before the record's own.
 */
public final class JsonLinesLogBatchEncoder implements LogBatchEncoder {
    public static final String DEFAULT_EVENT_NAME = "Log";
    public static final String CONTENT_TYPE = "application/x-ndjson";
    public static final String CONTENT_ENCODING = "gzip";

    private static final HexFormat HEX = HexFormat.of();

    private final ObjectMapper json;
    private final int maxRecordsPerBatch;
    private final Map<String, String> commonFields;

    public JsonLinesLogBatchEncoder(int maxRecordsPerBatch) {
        this(maxRecordsPerBatch, Map.of());
    }

    public JsonLinesLogBatchEncoder(int maxRecordsPerBatch, Map<String, String> commonFields) {
        this(new ObjectMapper(), maxRecordsPerBatch, commonFields);
    }

    public JsonLinesLogBatchEncoder(ObjectMapper json, int maxRecordsPerBatch, Map<String, String> commonFields) {
        if (maxRecordsPerBatch <= 0) throw new IllegalArgumentException("maxRecordsPerBatch must be > 0");
        this.json = Objects.requireNonNull(json, "json");
        this.maxRecordsPerBatch = maxRecordsPerBatch;
        this.commonFields = commonFields != null ? new LinkedHashMap<>(commonFields) : Map.of();
    }

    @Override
    public List<EncodedBatch> encode(List<LogRecord> records) throws EncodeException {
        if (records == null || records.isEmpty()) return List.of();

        Map<String, List<LogRecord>> byEvent = new LinkedHashMap<>();
        for (LogRecord record : records) {
            byEvent.computeIfAbsent(eventName(record), e -> new ArrayList<>()).add(record);
        }

        List<EncodedBatch> batches = new ArrayList<>();
        for (Map.Entry<String, List<LogRecord>> group : byEvent.entrySet()) {
            List<LogRecord> events = group.getValue();
            for (int from = 0; from < events.size(); from += maxRecordsPerBatch) {
                List<LogRecord> chunk = events.subList(from, Math.min(from + maxRecordsPerBatch, events.size()));
                batches.add(new EncodedBatch(
                        group.getKey(), gzipLines(group.getKey(), chunk), chunk.size(), CONTENT_TYPE, CONTENT_ENCODING));
            }
        }
        return batches;
    }

    private byte[] gzipLines(String eventName, List<LogRecord> chunk) throws EncodeException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            for (LogRecord record : chunk) {
                gzip.write(json.writeValueAsBytes(toLine(eventName, record)));
                gzip.write('\n');
            }
        } catch (JsonProcessingException e) {
            throw new EncodeException("Failed to serialize " + eventName + " record: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new EncodeException("Failed to compress " + eventName + " batch", e);
        }
        return buffer.toByteArray();
    }

    Map<String, Object> toLine(String eventName, LogRecord record) {
        Map<String, Object> line = new LinkedHashMap<>(commonFields);
        line.put("event", eventName);
        if (record.timeUnixNano() != null) {
            line.put("time", Instant.EPOCH.plusNanos(record.timeUnixNano()).toString());
            line.put("timeUnixNano", record.timeUnixNano());
        }
        putIfPresent(line, "observedTimeUnixNano", record.observedTimeUnixNano());
        putIfPresent(line, "severityNumber", record.severityNumber());
        putIfPresent(line, "severityText", severityText(record));
        putIfPresent(line, "body", record.body());
        byte[] traceId = record.traceId();
        if (traceId.length > 0) line.put("traceId", HEX.formatHex(traceId));
        byte[] spanId = record.spanId();
        if (spanId.length > 0) line.put("spanId", HEX.formatHex(spanId));
        putIfPresent(line, "flags", record.flags());
        if (!record.attributes().isEmpty()) {
            List<Map<String, Object>> attributes = new ArrayList<>(record.attributes().size());
            for (LogAttribute attribute : record.attributes()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("key", attribute.key());
                entry.put("value", attribute.value());
                attributes.add(entry);
            }
            line.put("attributes", attributes);
        }
        return line;
    }

    private static String eventName(LogRecord record) {
        String name = record.eventName();
        return name == null || name.isBlank() ? DEFAULT_EVENT_NAME : name;
    }

    private static String severityText(LogRecord record) {
        if (record.severityText() != null) return record.severityText();
        return record.severity().map(Severity::name).orElse(null);
    }

    private static void putIfPresent(Map<String, Object> line, String field, Object value) {
        if (value != null) line.put(field, value);
    }
}
