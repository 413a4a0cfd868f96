package com.arrowlog.testkit;

import static org.assertj.core.api.Assertions.assertThat;

import com.arrowlog.columnar.ColumnarBatch;
import com.arrowlog.columnar.PayloadType;
import com.arrowlog.columnar.join.DropReason;
import com.arrowlog.columnar.logs.LogRecordMaterializer;
import com.arrowlog.columnar.logs.MaterializedLogs;
import com.arrowlog.logs.model.LogAttribute;
import com.arrowlog.logs.model.LogBody;
import com.arrowlog.logs.model.LogRecord;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LogsBatchBuilderTest {

    private final BufferAllocator allocator = new RootAllocator();

    @AfterEach
    void tearDown() {
        allocator.close();
    }

    @Test
    void builtBatchDecodesBackToTheRowsThatWereAdded() {
        try (ColumnarBatch batch = new LogsBatchBuilder(allocator)
                .log(row -> row.time(1_700_000_000_000_000_001L)
                        .severity(17, "ERROR")
                        .body("card declined")
                        .traceId(new byte[] {1, 2})
                        .flags(1)
                        .eventName("PaymentEvent")
                        .resource(7)
                        .attribute("card.type", "visa")
                        .attribute("attempt", 2))
                .log(row -> row.time(5L))
                .resourceAttribute(7, "service.name", "payments")
                .build()) {

            MaterializedLogs logs = new LogRecordMaterializer().materialize(batch);

            assertThat(logs.records()).hasSize(2);
            LogRecord first = logs.records().get(0);
            assertThat(first.timeUnixNano()).isEqualTo(1_700_000_000_000_000_001L);
            assertThat(first.severityText()).isEqualTo("ERROR");
            assertThat(first.body()).isEqualTo(LogBody.of("card declined"));
            assertThat(first.flags()).isEqualTo(1L);
            assertThat(first.eventName()).isEqualTo("PaymentEvent");
            assertThat(first.attributes())
                    .containsExactly(
                            LogAttribute.of("card.type", "visa"),
                            LogAttribute.of("attempt", 2),
                            LogAttribute.of("service.name", "payments"));
            assertThat(logs.records().get(1).body()).isNull();
            assertThat(logs.records().get(1).attributes()).isEmpty();
        }
    }

    @Test
    void rawAttributeRowsReachTheDecoderUnchanged() {
        try (ColumnarBatch batch = new LogsBatchBuilder(allocator)
                .logs(2, "Log")
                .rawLogAttribute(null, "orphan", 1, "x", null)
                .rawLogAttribute(0, "ratio", 3, null, null)
                .build()) {

            MaterializedLogs logs = new LogRecordMaterializer().materialize(batch);

            assertThat(batch.rowCount(PayloadType.LOG_ATTRS)).isEqualTo(2);
            assertThat(logs.stats().dropped(DropReason.NULL_PARENT)).isEqualTo(1);
            assertThat(logs.stats().dropped(DropReason.UNSUPPORTED_TYPE)).isEqualTo(1);
        }
    }
}
