package com.arrowlog.exporter.encode;

import com.arrowlog.logs.model.LogRecord;
import com.arrowlog.transport.EncodedBatch;
import java.util.List;

/**
 * Turns decoded log records into upload units. An encoder may split records across several batches; it never drops
 * records silently.
 */
public interface LogBatchEncoder {

    List<EncodedBatch> encode(List<LogRecord> records) throws EncodeException;
}
