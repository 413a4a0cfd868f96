package com.arrowlog.columnar.access;

import com.arrowlog.columnar.ColumnarTable;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.IntPredicate;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.FixedSizeBinaryVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.LargeVarBinaryVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampNanoTZVector;
import org.apache.arrow.vector.TimeStampNanoVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;

/**
 * Typed access to the named columns of one {@link ColumnarTable}, or of the sub-fields of one struct column.
 *
 * <p>Every narrowing returns {@link Optional#empty()} when the column is absent or has an unexpected physical layout
 * and reports a {@link ColumnIssue}; nothing here throws on malformed input. Dictionary-encoded columns are resolved
 * key by key against the table's {@link DictionaryProvider}, both lookups bounds-checked.
 */
public final class ColumnAccessor {

    private final String path;
    private final int rowCount;
    private final Function<String, FieldVector> vectors;
    private final IntPredicate parentNull;
    private final DictionaryProvider dictionaries;
    private final ColumnIssueListener issues;

    private ColumnAccessor(
            String path,
            int rowCount,
            Function<String, FieldVector> vectors,
            IntPredicate parentNull,
            DictionaryProvider dictionaries,
            ColumnIssueListener issues) {
        this.path = path;
        this.rowCount = rowCount;
        this.vectors = vectors;
        this.parentNull = parentNull;
        this.dictionaries = dictionaries;
        this.issues = issues != null ? issues : ColumnIssueListener.NONE;
    }

    public static ColumnAccessor of(ColumnarTable table) {
        return of(table, ColumnIssueListener.NONE);
    }

    public static ColumnAccessor of(ColumnarTable table, ColumnIssueListener issues) {
        Objects.requireNonNull(table, "table");
        return new ColumnAccessor(
                "", table.rowCount(), table.root()::getVector, row -> false, table.dictionaries(), issues);
    }

    public int rowCount() {
        return rowCount;
    }

    /** Raw vector lookup. Reports {@link ColumnIssue.Kind#MISSING} when absent. */
    public Optional<FieldVector> column(String name) {
        FieldVector vector = vectors.apply(name);
        if (vector == null) {
            issues.onIssue(new ColumnIssue(path + name, ColumnIssue.Kind.MISSING, null));
            return Optional.empty();
        }
        return Optional.of(vector);
    }

    /** Nanosecond timestamps, with or without a time zone. */
    public Optional<Column<Long>> timestampNanos(String name) {
        return plain(name).flatMap(v -> {
            if (v instanceof TimeStampNanoVector || v instanceof TimeStampNanoTZVector) {
                TimeStampVector ts = (TimeStampVector) v;
                return Optional.of(column(name, v, row -> ts.isNull(row) ? Optional.empty() : Optional.of(ts.get(row))));
            }
            return mismatch(name, v, "timestamp[ns]");
        });
    }

    /** UTF-8 strings, dictionary-encoded or plain. */
    public Optional<Column<String>> strings(String name) {
        return column(name).flatMap(v -> {
            if (isDictionaryEncoded(v)) {
                return dictionary(name, v).flatMap(d -> {
                    if (d.getVector() instanceof VarCharVector chars) {
                        return Optional.of(dictionaryColumn(name, v, chars, key -> utf8(chars, key)));
                    }
                    return mismatch(name, d.getVector(), "dictionary<utf8>");
                });
            }
            if (v instanceof VarCharVector chars) {
                return Optional.of(column(name, v, row -> chars.isNull(row) ? Optional.empty() : Optional.of(utf8(chars, row))));
            }
            return mismatch(name, v, "utf8");
        });
    }

    /** Signed integers widened to {@code long}, dictionary-encoded or plain. */
    public Optional<Column<Long>> ints(String name) {
        return column(name).flatMap(v -> {
            if (isDictionaryEncoded(v)) {
                return dictionary(name, v).flatMap(d -> {
                    FieldVector values = d.getVector();
                    if (isSignedInt(values)) {
                        BaseIntVector ints = (BaseIntVector) values;
                        return Optional.of(dictionaryColumn(name, v, values, ints::getValueAsLong));
                    }
                    return mismatch(name, values, "dictionary<int>");
                });
            }
            if (isSignedInt(v)) {
                BaseIntVector ints = (BaseIntVector) v;
                return Optional.of(column(name, v, row -> v.isNull(row) ? Optional.empty() : Optional.of(ints.getValueAsLong(row))));
            }
            return mismatch(name, v, "int");
        });
    }

    /** Unsigned integers up to 32 bits, plus raw {@code uint64}, as {@code long}. */
    public Optional<Column<Long>> unsigned(String name) {
        return plain(name).flatMap(v -> {
            if (v instanceof UInt1Vector || v instanceof UInt2Vector || v instanceof UInt4Vector || v instanceof UInt8Vector) {
                BaseIntVector ints = (BaseIntVector) v;
                return Optional.of(column(name, v, row -> v.isNull(row) ? Optional.empty() : Optional.of(ints.getValueAsLong(row))));
            }
            return mismatch(name, v, "uint");
        });
    }

    /** Variable or fixed width binary. */
    public Optional<Column<byte[]>> binary(String name) {
        return plain(name).flatMap(v -> {
            if (v instanceof VarBinaryVector || v instanceof FixedSizeBinaryVector || v instanceof LargeVarBinaryVector) {
                return Optional.of(column(name, v, row -> Optional.ofNullable((byte[]) v.getObject(row))));
            }
            return mismatch(name, v, "binary");
        });
    }

    /**
     * Accessor over the sub-fields of a struct column. A null struct cell makes every sub-field of that row read as
     * absent.
     */
    public Optional<ColumnAccessor> nested(String name) {
        return plain(name).flatMap(v -> {
            if (v instanceof StructVector struct) {
                return Optional.of(new ColumnAccessor(
                        path + name + ".",
                        Math.min(rowCount, struct.getValueCount()),
                        child -> childOf(struct, child),
                        row -> parentNull.test(row) || struct.isNull(row),
                        dictionaries,
                        issues));
            }
            return mismatch(name, v, "struct");
        });
    }

    private Optional<FieldVector> plain(String name) {
        return column(name).flatMap(v -> {
            if (isDictionaryEncoded(v)) return mismatch(name, v, "non-dictionary column");
            return Optional.of(v);
        });
    }

    private Optional<Dictionary> dictionary(String name, FieldVector keys) {
        if (!(keys instanceof BaseIntVector)) {
            return mismatch(name, keys, "integer dictionary keys");
        }
        long id = keys.getField().getDictionary().getId();
        Dictionary dictionary = dictionaries.lookup(id);
        if (dictionary == null) {
            issues.onIssue(new ColumnIssue(path + name, ColumnIssue.Kind.MISSING_DICTIONARY, "dictionary id " + id));
            return Optional.empty();
        }
        return Optional.of(dictionary);
    }

    private <T> Column<T> column(String name, FieldVector vector, IntFunction<Optional<T>> reader) {
        return new VectorColumn<>(path + name, Math.min(rowCount, vector.getValueCount()), parentNull, reader);
    }

    private <T> Column<T> dictionaryColumn(String name, FieldVector keyVector, FieldVector values, IntFunction<T> valueAt) {
        BaseIntVector keys = (BaseIntVector) keyVector;
        int size = values.getValueCount();
        return column(name, keyVector, row -> {
            if (keyVector.isNull(row)) return Optional.empty();
            long key = keys.getValueAsLong(row);
            if (key < 0 || key >= size || values.isNull((int) key)) return Optional.empty();
            return Optional.of(valueAt.apply((int) key));
        });
    }

    private <T> Optional<T> mismatch(String name, Object vector, String expected) {
        String actual = vector instanceof FieldVector fv ? String.valueOf(fv.getField().getType()) : String.valueOf(vector);
        issues.onIssue(new ColumnIssue(
                path + name, ColumnIssue.Kind.UNEXPECTED_TYPE, "expected " + expected + " but was " + actual));
        return Optional.empty();
    }

    private static boolean isDictionaryEncoded(FieldVector vector) {
        DictionaryEncoding encoding = vector.getField().getDictionary();
        return encoding != null;
    }

    private static boolean isSignedInt(FieldVector vector) {
        return vector instanceof BigIntVector
                || vector instanceof IntVector
                || vector instanceof SmallIntVector
                || vector instanceof TinyIntVector;
    }

    private static FieldVector childOf(StructVector struct, String name) {
        for (FieldVector child : struct.getChildrenFromFields()) {
            if (name.equals(child.getName())) return child;
        }
        return null;
    }

    private static String utf8(VarCharVector vector, int index) {
        return new String(vector.get(index), StandardCharsets.UTF_8);
    }
}
