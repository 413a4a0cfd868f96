package com.arrowlog.transport;

import java.util.Arrays;
import java.util.Objects;

/**
 * One upload unit produced by an encoder: the body bytes plus what the transport needs to describe them.
 *
 * @param eventName event (table) name the records were grouped under
 * @param data encoded body, possibly compressed
 * @param recordCount number of log records in the body
 * @param contentType media type of the uncompressed body
 * @param contentEncoding compression applied to the body, {@code null} for none
 */
public record EncodedBatch(String eventName, byte[] data, int recordCount, String contentType, String contentEncoding) {

    public EncodedBatch {
        Objects.requireNonNull(eventName, "eventName");
        data = data != null ? data.clone() : new byte[0];
        if (recordCount < 0) throw new IllegalArgumentException("recordCount must be >= 0");
    }

    /** Copy of the body; the batch itself never changes. */
    @Override
    public byte[] data() {
        return data.clone();
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncodedBatch other)) return false;
        return recordCount == other.recordCount
                && eventName.equals(other.eventName)
                && Arrays.equals(data, other.data)
                && Objects.equals(contentType, other.contentType)
                && Objects.equals(contentEncoding, other.contentEncoding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventName, Arrays.hashCode(data), recordCount, contentType, contentEncoding);
    }

    @Override
    public String toString() {
        return "EncodedBatch{event=" + eventName + ", records=" + recordCount + ", bytes=" + data.length + '}';
    }
}
