package com.arrowlog.logs.model;

import io.opentelemetry.api.logs.Severity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One decoded log entry.
 *
 * <p>Optional scalar fields are {@code null} when the source cell was absent or null. Trace and span ids are empty
 * arrays rather than {@code null}. Attributes keep append order: a record's own attributes first, then the attributes
 * of its resource. Duplicate keys are kept as-is.
 */
public final class LogRecord {

    private static final byte[] NO_ID = new byte[0];

    private final Long timeUnixNano;
    private final Long observedTimeUnixNano;
    private final Integer severityNumber;
    private final String severityText;
    private final LogBody body;
    private final byte[] traceId;
    private final byte[] spanId;
    private final Long flags;
    private final List<LogAttribute> attributes;
    private final String eventName;

    private LogRecord(Builder b) {
        this.timeUnixNano = b.timeUnixNano;
        this.observedTimeUnixNano = b.observedTimeUnixNano;
        this.severityNumber = b.severityNumber;
        this.severityText = b.severityText;
        this.body = b.body;
        this.traceId = b.traceId != null ? b.traceId : NO_ID;
        this.spanId = b.spanId != null ? b.spanId : NO_ID;
        this.flags = b.flags;
        this.attributes = Collections.unmodifiableList(new ArrayList<>(b.attributes));
        this.eventName = b.eventName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Long timeUnixNano() {
        return timeUnixNano;
    }

    public Long observedTimeUnixNano() {
        return observedTimeUnixNano;
    }

    public Integer severityNumber() {
        return severityNumber;
    }

    public String severityText() {
        return severityText;
    }

    /** OpenTelemetry severity for {@link #severityNumber()}, empty when absent or outside 1..24. */
    public Optional<Severity> severity() {
        if (severityNumber == null) return Optional.empty();
        for (Severity s : Severity.values()) {
            if (s != Severity.UNDEFINED_SEVERITY_NUMBER && s.getSeverityNumber() == severityNumber) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public LogBody body() {
        return body;
    }

    public byte[] traceId() {
        return traceId.clone();
    }

    public byte[] spanId() {
        return spanId.clone();
    }

    /** Unsigned 32-bit trace flags. */
    public Long flags() {
        return flags;
    }

    public List<LogAttribute> attributes() {
        return attributes;
    }

    public String eventName() {
        return eventName;
    }

    @Override
    public String toString() {
        return "LogRecord{time=" + timeUnixNano
                + ", severity=" + severityNumber
                + ", body=" + body
                + ", attributes=" + attributes.size()
                + ", traceId=" + Arrays.toString(traceId)
                + '}';
    }

    public static final class Builder {
        private Long timeUnixNano;
        private Long observedTimeUnixNano;
        private Integer severityNumber;
        private String severityText;
        private LogBody body;
        private byte[] traceId;
        private byte[] spanId;
        private Long flags;
        private final List<LogAttribute> attributes = new ArrayList<>();
        private String eventName;

        private Builder() {}

        public Builder timeUnixNano(Long timeUnixNano) {
            this.timeUnixNano = timeUnixNano;
            return this;
        }

        public Builder observedTimeUnixNano(Long observedTimeUnixNano) {
            this.observedTimeUnixNano = observedTimeUnixNano;
            return this;
        }

        public Builder severityNumber(Integer severityNumber) {
            this.severityNumber = severityNumber;
            return this;
        }

        public Builder severityText(String severityText) {
            this.severityText = severityText;
            return this;
        }

        public Builder body(LogBody body) {
            this.body = body;
            return this;
        }

        public Builder traceId(byte[] traceId) {
            this.traceId = traceId != null ? traceId.clone() : null;
            return this;
        }

        public Builder spanId(byte[] spanId) {
            this.spanId = spanId != null ? spanId.clone() : null;
            return this;
        }

        public Builder flags(Long flags) {
            this.flags = flags;
            return this;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder addAttribute(LogAttribute attribute) {
            if (attribute != null) this.attributes.add(attribute);
            return this;
        }

        public Builder addAttributes(List<LogAttribute> attributes) {
            if (attributes != null) attributes.forEach(this::addAttribute);
            return this;
        }

        public LogRecord build() {
            return new LogRecord(this);
        }
    }
}
