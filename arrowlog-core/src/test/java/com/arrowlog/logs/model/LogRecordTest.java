package com.arrowlog.logs.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.api.logs.Severity;
import org.junit.jupiter.api.Test;

class LogRecordTest {

    @Test
    void absentIdsReadAsEmptyArrays() {
        LogRecord record = LogRecord.builder().build();

        assertThat(record.traceId()).isEmpty();
        assertThat(record.spanId()).isEmpty();
        assertThat(record.attributes()).isEmpty();
        assertThat(record.severity()).isEmpty();
    }

    @Test
    void keepsAttributeAppendOrderWithDuplicates() {
        LogRecord record = LogRecord.builder()
                .addAttribute(LogAttribute.of("service.name", "checkout"))
                .addAttribute(LogAttribute.of("retries", 2))
                .addAttribute(LogAttribute.of("service.name", "resource-level"))
                .build();

        assertThat(record.attributes())
                .extracting(LogAttribute::key)
                .containsExactly("service.name", "retries", "service.name");
        assertThat(record.attributes().get(1).value()).isEqualTo(new AttributeValue.IntValue(2));
    }

    @Test
    void mapsSeverityNumberOntoOpenTelemetrySeverity() {
        assertThat(LogRecord.builder().severityNumber(9).build().severity()).contains(Severity.INFO);
        assertThat(LogRecord.builder().severityNumber(17).build().severity()).contains(Severity.ERROR);
        assertThat(LogRecord.builder().severityNumber(99).build().severity()).isEmpty();
    }

    @Test
    void attributeTypeTagsResolveOnlySupportedVariants() {
        assertThat(AttributeType.fromTag(1)).contains(AttributeType.STRING);
        assertThat(AttributeType.fromTag(2)).contains(AttributeType.INT);
        assertThat(AttributeType.fromTag(3)).isEmpty();
        assertThat(AttributeType.fromTag(0)).isEmpty();
    }

    @Test
    void idsAreDefensivelyCopied() {
        byte[] trace = {1, 2, 3};
        LogRecord record = LogRecord.builder().traceId(trace).build();
        trace[0] = 9;

        assertThat(record.traceId()).containsExactly(1, 2, 3);
    }
}
