package com.arrowlog.columnar;

import java.util.Objects;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;

/**
 * One Arrow record batch together with the dictionaries its dictionary-encoded columns point into. Owns both and
 * releases their memory on {@link #close()}.
 */
public final class ColumnarTable implements AutoCloseable {

    private final VectorSchemaRoot root;
    private final DictionaryProvider dictionaries;

    public ColumnarTable(VectorSchemaRoot root, DictionaryProvider dictionaries) {
        this.root = Objects.requireNonNull(root, "root");
        this.dictionaries = dictionaries != null ? dictionaries : new DictionaryProvider.MapDictionaryProvider();
    }

    public static ColumnarTable of(VectorSchemaRoot root) {
        return new ColumnarTable(root, null);
    }

    public VectorSchemaRoot root() {
        return root;
    }

    public DictionaryProvider dictionaries() {
        return dictionaries;
    }

    public int rowCount() {
        return root.getRowCount();
    }

    @Override
    public void close() {
        for (Long id : dictionaries.getDictionaryIds()) {
            Dictionary dictionary = dictionaries.lookup(id);
            if (dictionary != null) dictionary.getVector().close();
        }
        root.close();
    }
}
