package com.arrowlog.columnar.access;

import static com.arrowlog.columnar.ArrowFixtures.binary;
import static com.arrowlog.columnar.ArrowFixtures.columns;
import static com.arrowlog.columnar.ArrowFixtures.dictionaryKeys;
import static com.arrowlog.columnar.ArrowFixtures.int32;
import static com.arrowlog.columnar.ArrowFixtures.intDictionary;
import static com.arrowlog.columnar.ArrowFixtures.stringDictionary;
import static com.arrowlog.columnar.ArrowFixtures.structOfDictionaryStrings;
import static com.arrowlog.columnar.ArrowFixtures.table;
import static com.arrowlog.columnar.ArrowFixtures.timestamps;
import static com.arrowlog.columnar.ArrowFixtures.uint32;
import static com.arrowlog.columnar.ArrowFixtures.utf8;
import static org.assertj.core.api.Assertions.assertThat;

import com.arrowlog.columnar.ColumnarTable;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ColumnAccessorTest {

    private BufferAllocator allocator;
    private ColumnarTable table;
    private final List<ColumnIssue> issues = new ArrayList<>();

    @BeforeEach
    void setUp() {
        allocator = new RootAllocator();
    }

    @AfterEach
    void tearDown() {
        if (table != null) table.close();
        allocator.close();
    }

    @Test
    void timestampsReadBackWithNanosecondPrecision() {
        table = table(columns(timestamps("time_unix_nano", allocator, 1_700_000_000_123_456_789L, null)), 2);
        Column<Long> time = accessor().timestampNanos("time_unix_nano").orElseThrow();

        assertThat(time.valueAt(0)).contains(1_700_000_000_123_456_789L);
        assertThat(time.valueAt(1)).isEmpty();
        assertThat(issues).isEmpty();
    }

    @Test
    void dictionaryStringsResolveThroughTheProvider() {
        table = table(
                columns(dictionaryKeys("severity_text", allocator, 7, 1, 0, null, 1)),
                4,
                stringDictionary(allocator, 7, "INFO", "ERROR"));
        Column<String> text = accessor().strings("severity_text").orElseThrow();

        assertThat(text.valueAt(0)).contains("ERROR");
        assertThat(text.valueAt(1)).contains("INFO");
        assertThat(text.valueAt(2)).isEmpty();
        assertThat(text.valueAt(3)).contains("ERROR");
    }

    @Test
    void dictionaryKeyOutsideTheDictionaryReadsAsAbsent() {
        table = table(
                columns(dictionaryKeys("severity_text", allocator, 7, 0, 5)),
                2,
                stringDictionary(allocator, 7, "INFO"));
        Column<String> text = accessor().strings("severity_text").orElseThrow();

        assertThat(text.valueAt(0)).contains("INFO");
        assertThat(text.valueAt(1)).isEmpty();
    }

    @Test
    void rowsOutsideTheTableReadAsAbsent() {
        table = table(columns(utf8("severity_text", allocator, "WARN")), 1);
        Column<String> text = accessor().strings("severity_text").orElseThrow();

        assertThat(text.valueAt(0)).contains("WARN");
        assertThat(text.valueAt(1)).isEmpty();
        assertThat(text.valueAt(-1)).isEmpty();
    }

    @Test
    void intsAcceptPlainAndDictionaryEncodedColumns() {
        table = table(
                columns(
                        int32("severity_number", allocator, 9, 17),
                        dictionaryKeys("int", allocator, 3, 1, 0)),
                2,
                intDictionary(allocator, 3, -4L, 1_000_000_000_000L));
        ColumnAccessor accessor = accessor();

        assertThat(accessor.ints("severity_number").orElseThrow().valueAt(1)).contains(17L);
        assertThat(accessor.ints("int").orElseThrow().valueAt(0)).contains(1_000_000_000_000L);
        assertThat(accessor.ints("int").orElseThrow().valueAt(1)).contains(-4L);
    }

    @Test
    void unsignedReadsFullThirtyTwoBitRange() {
        table = table(columns(uint32("flags", allocator, -1, 1)), 2);
        Column<Long> flags = accessor().unsigned("flags").orElseThrow();

        assertThat(flags.valueAt(0)).contains(4_294_967_295L);
        assertThat(flags.valueAt(1)).contains(1L);
    }

    @Test
    void binaryReturnsCellBytes() {
        byte[] traceId = {0x0a, 0x0b, 0x0c};
        table = table(columns(binary("trace_id", allocator, traceId, null)), 2);
        Column<byte[]> ids = accessor().binary("trace_id").orElseThrow();

        assertThat(ids.valueAt(0)).hasValueSatisfying(v -> assertThat(v).containsExactly(0x0a, 0x0b, 0x0c));
        assertThat(ids.valueAt(1)).isEmpty();
    }

    @Test
    void nullStructCellHidesItsChildren() {
        table = table(
                columns(structOfDictionaryStrings("body", allocator, "str", 2, new boolean[] {true, false}, 0, 0)),
                2,
                stringDictionary(allocator, 2, "payment accepted"));
        Column<String> body = accessor().nested("body").orElseThrow().strings("str").orElseThrow();

        assertThat(body.name()).isEqualTo("body.str");
        assertThat(body.valueAt(0)).contains("payment accepted");
        assertThat(body.valueAt(1)).isEmpty();
    }

    @Test
    void missingColumnIsReportedNotThrown() {
        table = table(columns(utf8("severity_text", allocator, "INFO")), 1);

        assertThat(accessor().timestampNanos("time_unix_nano")).isEmpty();
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.column()).isEqualTo("time_unix_nano");
            assertThat(issue.kind()).isEqualTo(ColumnIssue.Kind.MISSING);
        });
    }

    @Test
    void unexpectedLayoutIsReportedAsTypeMismatch() {
        table = table(columns(utf8("time_unix_nano", allocator, "yesterday")), 1);

        assertThat(accessor().timestampNanos("time_unix_nano")).isEmpty();
        assertThat(issues).extracting(ColumnIssue::kind).containsExactly(ColumnIssue.Kind.UNEXPECTED_TYPE);
    }

    @Test
    void dictionaryColumnWithoutItsDictionaryIsReported() {
        table = table(columns(dictionaryKeys("severity_text", allocator, 42, 0)), 1);

        assertThat(accessor().strings("severity_text")).isEmpty();
        assertThat(issues).extracting(ColumnIssue::kind).containsExactly(ColumnIssue.Kind.MISSING_DICTIONARY);
    }

    private ColumnAccessor accessor() {
        return ColumnAccessor.of(table, issues::add);
    }
}
