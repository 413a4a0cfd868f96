package com.arrowlog.columnar;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampNanoVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.FieldType;

/** Low-level Arrow builders for columnar tests. A {@code null} element writes a null cell. */
public final class ArrowFixtures {

    private static final ArrowType.Int UINT8 = new ArrowType.Int(8, false);

    private ArrowFixtures() {}

    public static ColumnarTable table(List<FieldVector> vectors, int rows, Dictionary... dictionaries) {
        VectorSchemaRoot root = new VectorSchemaRoot(vectors);
        root.setRowCount(rows);
        return new ColumnarTable(root, new DictionaryProvider.MapDictionaryProvider(dictionaries));
    }

    public static Dictionary stringDictionary(BufferAllocator allocator, long id, String... values) {
        VarCharVector vector = utf8("dict-" + id, allocator, values);
        return new Dictionary(vector, encoding(id));
    }

    public static Dictionary intDictionary(BufferAllocator allocator, long id, Long... values) {
        BigIntVector vector = int64("dict-" + id, allocator, values);
        return new Dictionary(vector, encoding(id));
    }

    /** Dictionary keys as {@code uint8}, pointing into the dictionary with the given id. */
    public static UInt1Vector dictionaryKeys(String name, BufferAllocator allocator, long dictionaryId, Integer... keys) {
        UInt1Vector vector = new UInt1Vector(name, dictionaryFieldType(dictionaryId), allocator);
        fillUInt1(vector, keys);
        return vector;
    }

    public static UInt1Vector uint8(String name, BufferAllocator allocator, Integer... values) {
        UInt1Vector vector = new UInt1Vector(name, allocator);
        fillUInt1(vector, values);
        return vector;
    }

    public static UInt2Vector uint16(String name, BufferAllocator allocator, Integer... values) {
        UInt2Vector vector = new UInt2Vector(name, allocator);
        vector.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) vector.setNull(i);
            else vector.setSafe(i, values[i]);
        }
        vector.setValueCount(values.length);
        return vector;
    }

    public static UInt4Vector uint32(String name, BufferAllocator allocator, Integer... values) {
        UInt4Vector vector = new UInt4Vector(name, allocator);
        vector.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) vector.setNull(i);
            else vector.setSafe(i, values[i]);
        }
        vector.setValueCount(values.length);
        return vector;
    }

    public static IntVector int32(String name, BufferAllocator allocator, Integer... values) {
        IntVector vector = new IntVector(name, allocator);
        vector.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) vector.setNull(i);
            else vector.setSafe(i, values[i]);
        }
        vector.setValueCount(values.length);
        return vector;
    }

    public static BigIntVector int64(String name, BufferAllocator allocator, Long... values) {
        BigIntVector vector = new BigIntVector(name, allocator);
        vector.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) vector.setNull(i);
            else vector.setSafe(i, values[i]);
        }
        vector.setValueCount(values.length);
        return vector;
    }

    public static TimeStampNanoVector timestamps(String name, BufferAllocator allocator, Long... nanos) {
        TimeStampNanoVector vector = new TimeStampNanoVector(name, allocator);
        vector.allocateNew(nanos.length);
        for (int i = 0; i < nanos.length; i++) {
            if (nanos[i] == null) vector.setNull(i);
            else vector.setSafe(i, nanos[i]);
        }
        vector.setValueCount(nanos.length);
        return vector;
    }

    public static VarCharVector utf8(String name, BufferAllocator allocator, String... values) {
        VarCharVector vector = new VarCharVector(name, allocator);
        vector.allocateNew();
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) vector.setNull(i);
            else vector.setSafe(i, values[i].getBytes(StandardCharsets.UTF_8));
        }
        vector.setValueCount(values.length);
        return vector;
    }

    public static VarBinaryVector binary(String name, BufferAllocator allocator, byte[]... values) {
        VarBinaryVector vector = new VarBinaryVector(name, allocator);
        vector.allocateNew();
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) vector.setNull(i);
            else vector.setSafe(i, values[i]);
        }
        vector.setValueCount(values.length);
        return vector;
    }

    /**
     * A struct column with one dictionary-encoded string child. {@code definedRows[i] == false} makes row {@code i} a
     * null struct cell.
     */
    public static StructVector structOfDictionaryStrings(
            String name, BufferAllocator allocator, String child, long dictionaryId, boolean[] definedRows, Integer... keys) {
        StructVector struct = StructVector.empty(name, allocator);
        UInt1Vector childVector = struct.addOrGet(child, dictionaryFieldType(dictionaryId), UInt1Vector.class);
        struct.allocateNew();
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] == null) childVector.setNull(i);
            else childVector.setSafe(i, keys[i]);
            if (definedRows[i]) struct.setIndexDefined(i);
            else struct.setNull(i);
        }
        childVector.setValueCount(keys.length);
        struct.setValueCount(keys.length);
        return struct;
    }

    /** A struct column with one {@code uint16} child, as used for {@code resource.id}. */
    public static StructVector structOfUInt16(String name, BufferAllocator allocator, String child, Integer... values) {
        StructVector struct = StructVector.empty(name, allocator);
        UInt2Vector childVector = struct.addOrGet(child, FieldType.nullable(new ArrowType.Int(16, false)), UInt2Vector.class);
        struct.allocateNew();
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) childVector.setNull(i);
            else childVector.setSafe(i, values[i]);
            struct.setIndexDefined(i);
        }
        childVector.setValueCount(values.length);
        struct.setValueCount(values.length);
        return struct;
    }

    public static List<FieldVector> columns(FieldVector... vectors) {
        return new ArrayList<>(Arrays.asList(vectors));
    }

    private static void fillUInt1(UInt1Vector vector, Integer... values) {
        vector.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) vector.setNull(i);
            else vector.setSafe(i, values[i]);
        }
        vector.setValueCount(values.length);
    }

    private static FieldType dictionaryFieldType(long dictionaryId) {
        return new FieldType(true, UINT8, encoding(dictionaryId));
    }

    private static DictionaryEncoding encoding(long id) {
        return new DictionaryEncoding(id, false, UINT8);
    }
}
